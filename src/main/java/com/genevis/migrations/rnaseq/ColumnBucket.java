package com.genevis.migrations.rnaseq;

/**
 * Group a DEG table column belongs to; also the order groups appear in the created table.
 */
public enum ColumnBucket {
    ANNOTATION,
    SAMPLE_EXPRESSION,
    STATISTIC,
    READ_COUNT,
    FPKM
}
