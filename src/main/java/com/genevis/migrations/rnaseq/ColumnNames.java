package com.genevis.migrations.rnaseq;

import java.util.Locale;

/**
 * Maps DEG CSV headers to table column names. Table creation and row insertion both go
 * through {@link #canonicalize(String)}, so the two column lists cannot drift apart.
 */
public final class ColumnNames {

    private ColumnNames() {
    }

    public static String canonicalize(String header) {
        String trimmed = header == null ? "" : header.trim();
        if (RnaSeqConstants.HEADER_LOG2_FOLD_CHANGE.equals(trimmed)) {
            return RnaSeqConstants.COLUMN_LOG2_FOLD_CHANGE;
        }
        if (RnaSeqConstants.HEADER_LOG10_PADJ.equals(trimmed)) {
            return RnaSeqConstants.COLUMN_LOG10_PADJ;
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
