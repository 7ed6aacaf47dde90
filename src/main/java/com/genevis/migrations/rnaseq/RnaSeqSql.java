package com.genevis.migrations.rnaseq;

import com.genevis.migrations.db.SqlIdentifiers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * SQL statements for one comparison table, all generated from the same {@link TableSchema}.
 * Every DDL statement is safe to reissue on each run.
 */
public final class RnaSeqSql {

    private RnaSeqSql() {
    }

    public static String createTable(TableSchema schema) {
        List<String> definitions = new ArrayList<>(schema.columns().size() + 1);
        for (ColumnSpec column : schema.columns()) {
            String definition = SqlIdentifiers.quote(column.name()) + " " + column.sqlType();
            definitions.add(column.primaryKey() ? definition + " PRIMARY KEY" : definition);
        }
        definitions.add(SqlIdentifiers.quote(RnaSeqConstants.COLUMN_CREATED_AT) + " TIMESTAMP DEFAULT CURRENT_TIMESTAMP");

        return "CREATE TABLE IF NOT EXISTS " + SqlIdentifiers.quote(schema.tableName()) + " (\n    "
                + String.join(",\n    ", definitions) + "\n)";
    }

    /**
     * Lookup indexes on gene name, chromosome, adjusted p-value and log2 fold change.
     */
    public static List<String> createIndexes(TableSchema schema) {
        String prefix = "idx_" + schema.tableName().toLowerCase(Locale.ROOT);
        String table = SqlIdentifiers.quote(schema.tableName());
        return List.of(
                createIndex(prefix + "_gene_name", table, RnaSeqConstants.COLUMN_GENE_NAME),
                createIndex(prefix + "_chromosome", table, RnaSeqConstants.COLUMN_GENE_CHR),
                createIndex(prefix + "_padj", table, RnaSeqConstants.COLUMN_PADJ),
                createIndex(prefix + "_log2fc", table, RnaSeqConstants.COLUMN_LOG2_FOLD_CHANGE)
        );
    }

    public static String grant(TableSchema schema, String role) {
        return "GRANT ALL PRIVILEGES ON TABLE " + SqlIdentifiers.quote(schema.tableName())
                + " TO " + SqlIdentifiers.quote(SqlIdentifiers.requireRoleName(role));
    }

    /**
     * Parameterized upsert over {@link TableSchema#insertColumns()}, keyed by {@code gene_id}.
     */
    public static String upsert(TableSchema schema, ConflictPolicy policy) {
        List<ColumnSpec> insertColumns = schema.insertColumns();
        String columnList = insertColumns.stream()
                .map(column -> SqlIdentifiers.quote(column.name()))
                .collect(Collectors.joining(", "));
        String placeholders = String.join(", ", Collections.nCopies(insertColumns.size(), "?"));

        List<String> refreshed = insertColumns.stream()
                .filter(column -> !column.primaryKey())
                .filter(column -> policy == ConflictPolicy.REFRESH_ALL
                        || RnaSeqConstants.COLUMN_GENE_NAME.equals(column.name()))
                .map(column -> SqlIdentifiers.quote(column.name()) + " = EXCLUDED." + SqlIdentifiers.quote(column.name()))
                .toList();
        String conflictAction = refreshed.isEmpty()
                ? "DO NOTHING"
                : "DO UPDATE SET " + String.join(", ", refreshed);

        return "INSERT INTO " + SqlIdentifiers.quote(schema.tableName()) + " (" + columnList + ")"
                + " VALUES (" + placeholders + ")"
                + " ON CONFLICT (" + SqlIdentifiers.quote(RnaSeqConstants.COLUMN_GENE_ID) + ") " + conflictAction;
    }

    public static String countRows(String tableName) {
        return "SELECT COUNT(*) FROM " + SqlIdentifiers.quote(tableName);
    }

    private static String createIndex(String indexName, String quotedTable, String column) {
        return "CREATE INDEX IF NOT EXISTS " + SqlIdentifiers.quote(indexName)
                + " ON " + quotedTable + " (" + SqlIdentifiers.quote(column) + ")";
    }
}
