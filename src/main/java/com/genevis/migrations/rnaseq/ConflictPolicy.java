package com.genevis.migrations.rnaseq;

/**
 * What an RNA-seq upsert overwrites when the gene already exists in the comparison table.
 */
public enum ConflictPolicy {

    /**
     * Every inserted column except the key takes the reloaded value.
     */
    REFRESH_ALL,

    /**
     * Only {@code gene_name} is refreshed; measurements from the first load are kept.
     */
    REFRESH_NAMES
}
