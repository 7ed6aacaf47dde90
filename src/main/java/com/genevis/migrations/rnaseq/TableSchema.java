package com.genevis.migrations.rnaseq;

import java.util.List;

/**
 * Ordered column layout of one comparison table, derived once from the CSV header and used
 * for both the CREATE TABLE and the INSERT statement.
 *
 * @param droppedHeaders source headers that matched no column group and are not loaded
 */
public record TableSchema(String tableName, List<ColumnSpec> columns, List<String> droppedHeaders) {

    public TableSchema {
        columns = List.copyOf(columns);
        droppedHeaders = List.copyOf(droppedHeaders);
    }

    /**
     * Columns that receive values from the CSV, in table order.
     */
    public List<ColumnSpec> insertColumns() {
        return columns.stream().filter(ColumnSpec::presentInSource).toList();
    }

    public List<String> columnNames() {
        return columns.stream().map(ColumnSpec::name).toList();
    }

    public List<ColumnSpec> columnsIn(ColumnBucket bucket) {
        return columns.stream().filter(column -> column.bucket() == bucket).toList();
    }
}
