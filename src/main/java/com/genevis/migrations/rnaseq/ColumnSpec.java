package com.genevis.migrations.rnaseq;

/**
 * One column of a derived comparison table.
 *
 * @param name        canonical (lowercase) column name
 * @param sourceIndex position of the source header in the CSV, or -1 when the file lacks it
 * @param sqlType     column type as written in the CREATE TABLE statement
 */
public record ColumnSpec(String name, int sourceIndex, String sqlType, ColumnType type, ColumnBucket bucket) {

    public boolean presentInSource() {
        return sourceIndex >= 0;
    }

    public boolean primaryKey() {
        return RnaSeqConstants.COLUMN_GENE_ID.equals(name);
    }

    ColumnSpec withSourceIndex(int index) {
        return new ColumnSpec(name, index, sqlType, type, bucket);
    }
}
