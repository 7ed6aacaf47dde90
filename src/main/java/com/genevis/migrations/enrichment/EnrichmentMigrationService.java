package com.genevis.migrations.enrichment;

import com.genevis.migrations.db.SqlIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Orchestrates the enrichment migration: scan source tree, parse every file, then upsert each
 * file's records into the enrichment table inside its own transaction.
 */
@Service
public class EnrichmentMigrationService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentMigrationService.class);

    private final EnrichmentProperties enrichmentProperties;
    private final EnrichmentFileScanner fileScanner;
    private final EnrichmentFileParser fileParser;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public EnrichmentMigrationService(EnrichmentProperties enrichmentProperties,
                                      EnrichmentFileScanner fileScanner,
                                      EnrichmentFileParser fileParser,
                                      JdbcTemplate jdbcTemplate,
                                      TransactionTemplate transactionTemplate) {
        this.enrichmentProperties = enrichmentProperties;
        this.fileScanner = fileScanner;
        this.fileParser = fileParser;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Runs one full migration. A dry run parses everything and reports what would be written
     * without touching the database.
     */
    public EnrichmentMigrationResult migrate(EnrichmentOptions options) {
        Path sourceDir = Path.of(enrichmentProperties.getSourceDir());
        String tableName = SqlIdentifiers.requireTableName(enrichmentProperties.getTableName());
        log.info("Source: {}", sourceDir.toAbsolutePath());
        log.info("Mode: {}", options.dryRun() ? "DRY RUN (no database writes)" : "LIVE MIGRATION");

        log.info("Step 1: Scanning for enrichment files...");
        List<EnrichmentFile> files = fileScanner.scan(sourceDir);
        log.info("Found {} enrichment files", files.size());
        if (files.isEmpty()) {
            log.error("No enrichment files found. Exiting.");
            return EnrichmentMigrationResult.noFiles(options.dryRun());
        }

        log.info("Step 2: Parsing enrichment data...");
        List<ParsedFile> parsedFiles = new ArrayList<>(files.size());
        Map<String, Integer> recordsByComparison = new TreeMap<>();
        int recordsParsed = 0;
        for (EnrichmentFile file : files) {
            log.debug("Processing: {} / {}", file.comparison(), file.database());
            List<EnrichmentRecord> records = fileParser.parse(file);
            parsedFiles.add(new ParsedFile(file, records));
            recordsParsed += records.size();
            if (!records.isEmpty()) {
                recordsByComparison.merge(file.comparison(), records.size(), Integer::sum);
            }
        }
        log.info("Parsed {} total enrichment records", recordsParsed);
        if (recordsParsed == 0) {
            log.error("No valid records parsed. Exiting.");
            return EnrichmentMigrationResult.noRecords(options.dryRun(), files.size());
        }

        int recordsWritten = 0;
        int filesFailed = 0;
        long tableRowCount = -1;
        if (options.dryRun()) {
            log.info("DRY RUN: Skipping database insertion");
            log.info("Would insert {} records", recordsParsed);
            logSampleRecord(parsedFiles);
        } else {
            log.info("Step 3: Inserting data into database...");
            ensureEnrichmentTable(tableName);
            if (options.clear()) {
                log.info("Clearing existing enrichment data...");
                clearEnrichmentData(tableName);
            }

            String upsertSql = buildUpsertSql(tableName);
            for (ParsedFile parsedFile : parsedFiles) {
                if (parsedFile.records().isEmpty()) {
                    continue;
                }
                if (upsertFile(upsertSql, parsedFile)) {
                    recordsWritten += parsedFile.records().size();
                } else {
                    filesFailed++;
                }
            }
            log.info("Migration complete! Inserted: {} records", recordsWritten);
            if (log.isDebugEnabled()) {
                tableRowCount = countRows(tableName);
                log.debug("Total rows in '{}': {}", tableName, tableRowCount);
            }
        }

        EnrichmentMigrationResult result = new EnrichmentMigrationResult(
                EnrichmentMigrationResult.Status.COMPLETED,
                options.dryRun(),
                files.size(),
                recordsParsed,
                recordsWritten,
                filesFailed,
                recordsByComparison,
                tableRowCount
        );
        logSummary(result);
        return result;
    }

    /**
     * Creates the enrichment table, its natural-key constraint and lookup indexes when absent.
     *
     * @throws IllegalStateException when no database connection can be obtained
     */
    void ensureEnrichmentTable(String tableName) {
        try {
            jdbcTemplate.execute(buildCreateTableSql(tableName));
            buildIndexSql(tableName).forEach(jdbcTemplate::execute);
        } catch (CannotGetJdbcConnectionException ex) {
            throw new IllegalStateException("Database connection failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Constraint names are prefixed with the lowercased table name.
     */
    String buildCreateTableSql(String tableName) {
        return """
                CREATE TABLE IF NOT EXISTS __TABLE__ (
                    id SERIAL PRIMARY KEY,
                    comparison VARCHAR(100) NOT NULL,
                    database VARCHAR(50) NOT NULL,
                    term_id VARCHAR(50) NOT NULL,
                    term_description TEXT NOT NULL,
                    genes_mapped INTEGER NOT NULL,
                    enrichment_score DOUBLE PRECISION NOT NULL,
                    direction VARCHAR(20) NOT NULL,
                    false_discovery_rate DOUBLE PRECISION NOT NULL,
                    method VARCHAR(20) NOT NULL,
                    matching_protein_ids TEXT,
                    matching_protein_labels TEXT,
                    created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                    updated_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                    CONSTRAINT __PREFIX___unique_record UNIQUE (comparison, database, term_id),
                    CONSTRAINT __PREFIX___check_database CHECK (database IN ('KEGG', 'Reactome', 'WikiPathways')),
                    CONSTRAINT __PREFIX___check_direction CHECK (direction IN ('bottom', 'top', 'both ends')),
                    CONSTRAINT __PREFIX___check_method CHECK (method IN ('ks', 'afc'))
                )
                """.replace("__TABLE__", SqlIdentifiers.quote(tableName))
                .replace("__PREFIX__", tableName.toLowerCase(Locale.ROOT));
    }

    /**
     * Lookup indexes named {@code idx_<lower(table)>_<suffix>}, so each configured table gets its own set.
     */
    List<String> buildIndexSql(String tableName) {
        String prefix = "idx_" + tableName.toLowerCase(Locale.ROOT);
        String table = SqlIdentifiers.quote(tableName);
        return List.of(
                "CREATE INDEX IF NOT EXISTS " + prefix + "_comparison ON " + table + " (comparison)",
                "CREATE INDEX IF NOT EXISTS " + prefix + "_database ON " + table + " (database)",
                "CREATE INDEX IF NOT EXISTS " + prefix + "_term_id ON " + table + " (term_id)",
                "CREATE INDEX IF NOT EXISTS " + prefix + "_comparison_database ON " + table + " (comparison, database)",
                "CREATE INDEX IF NOT EXISTS " + prefix + "_fdr ON " + table + " (false_discovery_rate)"
        );
    }

    /**
     * Deletes every enrichment row ahead of a full reload. A failure is logged; the upsert that
     * follows stays correct without it.
     */
    private void clearEnrichmentData(String tableName) {
        try {
            transactionTemplate.executeWithoutResult(status -> jdbcTemplate.update("DELETE FROM " + SqlIdentifiers.quote(tableName)));
            log.debug("Cleared existing enrichment data");
        } catch (CannotGetJdbcConnectionException | CannotCreateTransactionException ex) {
            throw new IllegalStateException("Database connection failed: " + ex.getMessage(), ex);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Error clearing data: {}", ex.getMessage(), ex);
        }
    }

    /**
     * Upserts one file's records in a single transaction; returns false when it was rolled back.
     *
     * @throws IllegalStateException when no database connection can be obtained
     */
    private boolean upsertFile(String upsertSql, ParsedFile parsedFile) {
        EnrichmentFile file = parsedFile.file();
        try {
            transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(
                    upsertSql,
                    parsedFile.records(),
                    enrichmentProperties.getBatchSize(),
                    this::bindRecord
            ));
            log.debug("Inserted {} records from {} / {}", parsedFile.records().size(), file.comparison(), file.database());
            return true;
        } catch (CannotGetJdbcConnectionException | CannotCreateTransactionException ex) {
            throw new IllegalStateException("Database connection failed: " + ex.getMessage(), ex);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Database error during insertion of {}: {}", file.path(), ex.getMessage(), ex);
            return false;
        }
    }

    String buildUpsertSql(String tableName) {
        return """
                INSERT INTO __TABLE__ (
                    comparison, database, term_id, term_description,
                    genes_mapped, enrichment_score, direction,
                    false_discovery_rate, method,
                    matching_protein_ids, matching_protein_labels
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (comparison, database, term_id) DO UPDATE SET
                    term_description = EXCLUDED.term_description,
                    genes_mapped = EXCLUDED.genes_mapped,
                    enrichment_score = EXCLUDED.enrichment_score,
                    direction = EXCLUDED.direction,
                    false_discovery_rate = EXCLUDED.false_discovery_rate,
                    method = EXCLUDED.method,
                    matching_protein_ids = EXCLUDED.matching_protein_ids,
                    matching_protein_labels = EXCLUDED.matching_protein_labels,
                    updated_at = CURRENT_TIMESTAMP
                """.replace("__TABLE__", SqlIdentifiers.quote(tableName));
    }

    private void bindRecord(PreparedStatement ps, EnrichmentRecord record) throws SQLException {
        ps.setString(1, record.comparison());
        ps.setString(2, record.database());
        ps.setString(3, record.termId());
        ps.setString(4, record.termDescription());
        ps.setInt(5, record.genesMapped());
        ps.setDouble(6, record.enrichmentScore());
        ps.setString(7, record.direction());
        ps.setDouble(8, record.falseDiscoveryRate());
        ps.setString(9, record.method());
        ps.setString(10, record.matchingProteinIds());
        ps.setString(11, record.matchingProteinLabels());
    }

    private long countRows(String tableName) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + SqlIdentifiers.quote(tableName), Long.class);
        return count == null ? 0 : count;
    }

    private void logSampleRecord(List<ParsedFile> parsedFiles) {
        if (!log.isDebugEnabled()) {
            return;
        }
        parsedFiles.stream()
                .flatMap(parsedFile -> parsedFile.records().stream())
                .findFirst()
                .ifPresent(sample -> {
                    log.debug("Sample record:");
                    sample.toColumnValues().forEach((column, value) -> log.debug("   {}: {}", column, abbreviate(value)));
                });
    }

    private String abbreviate(Object value) {
        String text = String.valueOf(value);
        int max = EnrichmentConstants.SAMPLE_VALUE_MAX_LENGTH;
        return text.length() > max ? text.substring(0, max) + "..." : text;
    }

    private void logSummary(EnrichmentMigrationResult result) {
        log.info("Migration Summary");
        log.info("Total files processed: {}", result.filesFound());
        log.info("Total records: {}", result.recordsParsed());
        log.info("Unique comparisons: {}", result.recordsByComparison().size());
        if (result.filesFailed() > 0) {
            log.warn("Files rolled back: {}", result.filesFailed());
        }
        if (log.isDebugEnabled()) {
            log.debug("Records by comparison:");
            new TreeMap<>(result.recordsByComparison())
                    .forEach((comparison, count) -> log.debug("   {}: {} records", comparison, count));
        }
    }

    private record ParsedFile(EnrichmentFile file, List<EnrichmentRecord> records) {
    }
}
