package com.genevis.migrations.rnaseq;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RnaSeqSqlTest {

    private final SchemaDeriver schemaDeriver = new SchemaDeriver(new RnaSeqProperties());

    private final TableSchema schema = schemaDeriver.derive("Treat_vs_Ctrl", List.of(
            "gene_id", "gene_name", "SHEF1", "SHEF1_readcount", "notes", "padj"));

    @Test
    void shouldCreateTableWithQuotedColumnsAndPrimaryKey() {
        String sql = RnaSeqSql.createTable(schema);

        assertTrue(sql.startsWith("CREATE TABLE IF NOT EXISTS \"Treat_vs_Ctrl\" ("));
        assertTrue(sql.contains("\"gene_id\" VARCHAR(50) PRIMARY KEY"));
        assertTrue(sql.contains("\"shef1\" DOUBLE PRECISION"));
        assertTrue(sql.contains("\"shef1_readcount\" INTEGER"));
        assertTrue(sql.contains("\"log10_padj\" DOUBLE PRECISION"));
        assertTrue(sql.trim().endsWith("\"created_at\" TIMESTAMP DEFAULT CURRENT_TIMESTAMP\n)"));
        assertFalse(sql.contains("notes"));
    }

    @Test
    void shouldNameIndexesAfterLowercasedTable() {
        List<String> indexes = RnaSeqSql.createIndexes(schema);

        assertEquals(4, indexes.size());
        assertEquals("CREATE INDEX IF NOT EXISTS \"idx_treat_vs_ctrl_gene_name\" ON \"Treat_vs_Ctrl\" (\"gene_name\")",
                indexes.get(0));
        assertTrue(indexes.get(1).contains("\"idx_treat_vs_ctrl_chromosome\"") && indexes.get(1).contains("(\"gene_chr\")"));
        assertTrue(indexes.get(2).contains("(\"padj\")"));
        assertTrue(indexes.get(3).contains("\"idx_treat_vs_ctrl_log2fc\"") && indexes.get(3).contains("(\"log2foldchange\")"));
    }

    @Test
    void shouldInsertOnlyColumnsPresentInSource() {
        String sql = RnaSeqSql.upsert(schema, ConflictPolicy.REFRESH_ALL);

        assertTrue(sql.startsWith("INSERT INTO \"Treat_vs_Ctrl\" (\"gene_id\", \"gene_name\", \"shef1\", \"padj\", \"shef1_readcount\")"));
        assertTrue(sql.contains("VALUES (?, ?, ?, ?, ?)"));
        assertTrue(sql.contains("ON CONFLICT (\"gene_id\") DO UPDATE SET"));
        assertTrue(sql.contains("\"padj\" = EXCLUDED.\"padj\""));
        assertTrue(sql.contains("\"shef1_readcount\" = EXCLUDED.\"shef1_readcount\""));
        assertFalse(sql.contains("\"gene_id\" = EXCLUDED"));
        assertFalse(sql.contains("notes"));
    }

    @Test
    void shouldRefreshOnlyNamesUnderNamePolicy() {
        String sql = RnaSeqSql.upsert(schema, ConflictPolicy.REFRESH_NAMES);

        assertTrue(sql.endsWith("ON CONFLICT (\"gene_id\") DO UPDATE SET \"gene_name\" = EXCLUDED.\"gene_name\""));
    }

    @Test
    void shouldDoNothingOnConflictWhenNoColumnQualifies() {
        TableSchema idOnly = schemaDeriver.derive("cmp", List.of("gene_id"));

        assertTrue(RnaSeqSql.upsert(idOnly, ConflictPolicy.REFRESH_ALL).endsWith("ON CONFLICT (\"gene_id\") DO NOTHING"));
    }

    @Test
    void shouldGrantToValidatedRole() {
        assertEquals("GRANT ALL PRIVILEGES ON TABLE \"Treat_vs_Ctrl\" TO \"gene_admin\"",
                RnaSeqSql.grant(schema, "gene_admin"));
        assertThrows(IllegalArgumentException.class, () -> RnaSeqSql.grant(schema, "admin; DROP"));
    }
}
