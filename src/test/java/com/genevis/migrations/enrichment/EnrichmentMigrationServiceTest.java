package com.genevis.migrations.enrichment;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EnrichmentMigrationServiceTest {

    @TempDir
    Path root;

    private EnrichmentProperties properties;
    private JdbcTemplate jdbcTemplate;
    private TransactionTemplate transactionTemplate;
    private EnrichmentMigrationService service;

    @BeforeEach
    void setUp() {
        properties = new EnrichmentProperties();
        properties.setSourceDir(root.toString());
        jdbcTemplate = mock(JdbcTemplate.class);
        transactionTemplate = mock(TransactionTemplate.class);
        service = new EnrichmentMigrationService(properties, new EnrichmentFileScanner(properties),
                new EnrichmentFileParser(), jdbcTemplate, transactionTemplate);
    }

    @Test
    void shouldCountRecordsOnDryRunWithoutTouchingDatabase() throws IOException {
        EnrichmentFixtures.writeFile(root, "A_vs_B", "enrichment.KEGG.json", EnrichmentFixtures.array(
                EnrichmentFixtures.term("hsa04110", "Cell cycle", 0.01),
                EnrichmentFixtures.term("", "dropped", 0.01)));
        EnrichmentFixtures.writeFile(root, "A_vs_B", "enrichment.RCTM.json", EnrichmentFixtures.array(
                EnrichmentFixtures.term("R-HSA-1640170", "Cell Cycle", 0.02)));
        EnrichmentFixtures.writeFile(root, "C_vs_D", "enrichment.KEGG.json", EnrichmentFixtures.array(
                EnrichmentFixtures.term("hsa03030", "DNA replication", 0.03)));
        EnrichmentFixtures.writeFile(root, "test_cmp", "enrichment.KEGG.json", EnrichmentFixtures.array(
                EnrichmentFixtures.term("hsa00010", "Glycolysis", 0.03)));

        EnrichmentMigrationResult result = service.migrate(new EnrichmentOptions(true, true));

        assertEquals(EnrichmentMigrationResult.Status.COMPLETED, result.status());
        assertEquals(3, result.filesFound());
        assertEquals(3, result.recordsParsed());
        assertEquals(0, result.recordsWritten());
        assertEquals(Map.of("A_vs_B", 2, "C_vs_D", 1), result.recordsByComparison());
        assertTrue(result.producedOutput());
        verifyNoInteractions(jdbcTemplate, transactionTemplate);
    }

    @Test
    void shouldReportNoFilesFound() {
        EnrichmentMigrationResult result = service.migrate(new EnrichmentOptions(true, false));

        assertEquals(EnrichmentMigrationResult.Status.NO_FILES, result.status());
        assertFalse(result.producedOutput());
    }

    @Test
    void shouldReportNoRecordsWhenEveryFileIsUnusable() throws IOException {
        EnrichmentFixtures.writeFile(root, "A_vs_B", "enrichment.KEGG.json", "{\"not\": \"an array\"}");
        EnrichmentFixtures.writeFile(root, "A_vs_B", "enrichment.RCTM.json", "[broken");

        EnrichmentMigrationResult result = service.migrate(new EnrichmentOptions(false, false));

        assertEquals(EnrichmentMigrationResult.Status.NO_RECORDS, result.status());
        assertEquals(2, result.filesFound());
        assertFalse(result.producedOutput());
        verifyNoInteractions(jdbcTemplate, transactionTemplate);
    }

    @Test
    void shouldFailWhenSourceDirectoryIsMissing() {
        properties.setSourceDir(root.resolve("absent").toString());

        assertThrows(IllegalStateException.class, () -> service.migrate(new EnrichmentOptions(true, false)));
    }

    @Test
    void shouldUpsertOnNaturalKeyAndBumpUpdatedAt() {
        String sql = service.buildUpsertSql("enrichment_data");

        assertTrue(sql.contains("INSERT INTO \"enrichment_data\" ("));
        assertTrue(sql.contains("ON CONFLICT (comparison, database, term_id) DO UPDATE SET"));
        assertTrue(sql.contains("updated_at = CURRENT_TIMESTAMP"));
        assertFalse(sql.contains("term_id = EXCLUDED.term_id"));
    }

    @Test
    void shouldNameIndexesAndConstraintsAfterConfiguredTable() {
        String createSql = service.buildCreateTableSql("Enrichment_V2");
        List<String> indexSql = service.buildIndexSql("Enrichment_V2");

        assertTrue(createSql.contains("CREATE TABLE IF NOT EXISTS \"Enrichment_V2\" ("));
        assertTrue(createSql.contains("CONSTRAINT enrichment_v2_unique_record UNIQUE (comparison, database, term_id)"));
        assertEquals(5, indexSql.size());
        assertEquals("CREATE INDEX IF NOT EXISTS idx_enrichment_v2_comparison ON \"Enrichment_V2\" (comparison)",
                indexSql.get(0));
        assertTrue(indexSql.stream().allMatch(sql -> sql.contains(" ON \"Enrichment_V2\" (")));
        assertTrue(service.buildIndexSql("enrichment_data").get(4).contains("idx_enrichment_data_fdr"));
    }

    @Test
    void shouldTreatUnreachableDatabaseAsFatal() throws Exception {
        EnrichmentFixtures.writeFile(root, "A_vs_B", "enrichment.KEGG.json", EnrichmentFixtures.array(
                EnrichmentFixtures.term("hsa04110", "Cell cycle", 0.01)));
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused", "08001"));
        EnrichmentMigrationService unreachable = new EnrichmentMigrationService(properties,
                new EnrichmentFileScanner(properties), new EnrichmentFileParser(),
                new JdbcTemplate(dataSource), new TransactionTemplate(new DataSourceTransactionManager(dataSource)));

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> unreachable.migrate(new EnrichmentOptions(false, true)));
        assertTrue(ex.getMessage().startsWith("Database connection failed"));
    }
}
