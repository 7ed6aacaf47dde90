package com.genevis.migrations.rnaseq;

import java.util.Set;

/**
 * Shared constants for the RNA-seq migration.
 */
public final class RnaSeqConstants {

    private RnaSeqConstants() {
    }

    public static final String DEFAULT_SOURCE_DIR = "src/graphs";
    public static final String DEFAULT_SAMPLE_PREFIX = "shef";
    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final String DEFAULT_GRANT_ROLE = "gene_admin";

    public static final String DEG_FILE_SUFFIX = ".DEG.all.csv";
    public static final String FILE_EXT_CSV = ".csv";

    public static final String COLUMN_GENE_ID = "gene_id";
    public static final String COLUMN_GENE_NAME = "gene_name";
    public static final String COLUMN_GENE_CHR = "gene_chr";
    public static final String COLUMN_PADJ = "padj";
    public static final String COLUMN_LOG2_FOLD_CHANGE = "log2foldchange";
    public static final String COLUMN_LOG10_PADJ = "log10_padj";
    public static final String COLUMN_CREATED_AT = "created_at";

    public static final String HEADER_LOG2_FOLD_CHANGE = "log2FoldChange";
    public static final String HEADER_LOG10_PADJ = "-log10(padj)";

    public static final String READ_COUNT_MARKER = "readcount";
    public static final String READ_COUNT_SUFFIX = "_readcount";
    public static final String FPKM_MARKER = "fpkm";
    public static final String FPKM_SUFFIX = "_fpkm";

    public static final Set<String> NULL_TOKENS = Set.of("", "na", "nan", "null", "none");

    public static final String MSG_CSV_EMPTY = "CSV file is empty: %s";
    public static final String MSG_CSV_READ_FAILED = "Unable to read CSV file: %s";
    public static final String MSG_CSV_NOT_FOUND = "CSV file not found: %s";
    public static final String MSG_GENE_ID_MISSING = "CSV header has no %s column".formatted(COLUMN_GENE_ID);
    public static final String MSG_DUPLICATE_COLUMN = "Headers %s and %s both map to column %s";
    public static final String MSG_UNRECOGNIZED_COLUMNS = "Unrecognized CSV columns: %s";
    public static final String MSG_NO_COMPARISONS = "No comparison directories found with CSV files in: %s";
    public static final String MSG_INVALID_VALUE = "Invalid %s value '%s' in column %s";
}
