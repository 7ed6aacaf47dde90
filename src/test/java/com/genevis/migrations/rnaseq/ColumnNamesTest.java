package com.genevis.migrations.rnaseq;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ColumnNamesTest {

    @Test
    void shouldApplySpecialRenames() {
        assertEquals("log2foldchange", ColumnNames.canonicalize("log2FoldChange"));
        assertEquals("log10_padj", ColumnNames.canonicalize("-log10(padj)"));
    }

    @Test
    void shouldLowercaseEverythingElse() {
        assertEquals("shef1_readcount", ColumnNames.canonicalize("SHEF1_readcount"));
        assertEquals("gene_id", ColumnNames.canonicalize(" gene_id "));
        assertEquals("padj", ColumnNames.canonicalize("padj"));
    }
}
