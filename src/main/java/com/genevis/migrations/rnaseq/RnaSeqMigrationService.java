package com.genevis.migrations.rnaseq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads {@code <comparison>.DEG.all.csv} files into one table per comparison whose columns are
 * derived from the file's own header.
 */
@Service
public class RnaSeqMigrationService {

    private static final Logger log = LoggerFactory.getLogger(RnaSeqMigrationService.class);

    private final RnaSeqProperties rnaSeqProperties;
    private final DegCsvReader csvReader;
    private final SchemaDeriver schemaDeriver;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public RnaSeqMigrationService(RnaSeqProperties rnaSeqProperties,
                                  DegCsvReader csvReader,
                                  SchemaDeriver schemaDeriver,
                                  JdbcTemplate jdbcTemplate,
                                  TransactionTemplate transactionTemplate) {
        this.rnaSeqProperties = rnaSeqProperties;
        this.csvReader = csvReader;
        this.schemaDeriver = schemaDeriver;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    public Path sourceDir() {
        return Path.of(rnaSeqProperties.getSourceDir());
    }

    /**
     * Sub-directories of the source root that hold at least one CSV file, sorted by name.
     * Hidden directories are ignored; a missing root yields an empty list.
     */
    public List<String> listAvailableComparisons() {
        Path root = sourceDir();
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(root)) {
            return children
                    .filter(Files::isDirectory)
                    .filter(dir -> !dir.getFileName().toString().startsWith("."))
                    .filter(this::containsCsv)
                    .map(dir -> dir.getFileName().toString())
                    .sorted(Comparator.naturalOrder())
                    .toList();
        } catch (IOException | UncheckedIOException ex) {
            throw new IllegalStateException("Unable to list comparisons in " + root, ex);
        }
    }

    /**
     * Migrates every available comparison in name order; one failure does not stop the rest.
     */
    public List<RnaSeqMigrationResult> migrateAll(boolean dryRun) {
        List<String> comparisons = listAvailableComparisons();
        if (comparisons.isEmpty()) {
            log.error(RnaSeqConstants.MSG_NO_COMPARISONS.formatted(sourceDir().toAbsolutePath()));
            return List.of();
        }

        log.info("Migrating {} comparisons", comparisons.size());
        List<RnaSeqMigrationResult> results = new ArrayList<>(comparisons.size());
        for (String comparison : comparisons) {
            results.add(migrateComparison(comparison, dryRun));
        }

        long successful = results.stream().filter(RnaSeqMigrationResult::success).count();
        log.info("Migration Summary");
        log.info("Successful: {}", successful);
        log.info("Failed: {}", results.size() - successful);
        log.info("Total: {}", results.size());
        return results;
    }

    /**
     * Reads, converts and upserts one comparison. Input and write errors fail this comparison
     * only and are reported in the result.
     *
     * @throws IllegalStateException when no database connection can be obtained, either directly
     *                               or when opening a transaction
     */
    public RnaSeqMigrationResult migrateComparison(String comparison, boolean dryRun) {
        log.info("Migrating comparison: {}", comparison);
        Path csvPath = sourceDir().resolve(comparison).resolve(comparison + RnaSeqConstants.DEG_FILE_SUFFIX);
        if (!Files.isRegularFile(csvPath)) {
            log.error(RnaSeqConstants.MSG_CSV_NOT_FOUND.formatted(csvPath));
            return RnaSeqMigrationResult.failed(comparison, dryRun, RnaSeqConstants.MSG_CSV_NOT_FOUND.formatted(csvPath));
        }

        try {
            DegTable table = csvReader.read(csvPath);
            log.info("Loaded {} rows, {} columns from {}", table.rows().size(), table.headers().size(), csvPath);

            TableSchema schema = schemaDeriver.derive(comparison, table.headers());
            if (!schema.droppedHeaders().isEmpty()) {
                log.warn("Columns not loaded into '{}' (no matching column group): {}",
                        schema.tableName(), schema.droppedHeaders());
            }

            List<Object[]> rows = convertRows(schema, table);
            int skipped = table.rows().size() - rows.size();

            if (dryRun) {
                log.info("DRY RUN: Would upsert {} rows into '{}'", rows.size(), schema.tableName());
                log.debug("Columns: {}", schema.columnNames());
                return new RnaSeqMigrationResult(comparison, true, true, table.rows().size(), skipped, 0, -1,
                        schema.droppedHeaders(), null);
            }

            createTable(schema);
            upsertRows(schema, rows);
            long rowCount = countRows(schema.tableName());
            log.info("Upserted {} rows into '{}' ({} rows in table)", rows.size(), schema.tableName(), rowCount);
            return new RnaSeqMigrationResult(comparison, true, false, table.rows().size(), skipped, rows.size(),
                    rowCount, schema.droppedHeaders(), null);
        } catch (CannotGetJdbcConnectionException | CannotCreateTransactionException ex) {
            throw new IllegalStateException("Database connection failed: " + ex.getMessage(), ex);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Database error while migrating {}: {}", comparison, ex.getMessage(), ex);
            return RnaSeqMigrationResult.failed(comparison, dryRun, ex.getMessage());
        } catch (IllegalArgumentException | IllegalStateException ex) {
            log.error("Error migrating {}: {}", comparison, ex.getMessage());
            return RnaSeqMigrationResult.failed(comparison, dryRun, ex.getMessage());
        }
    }

    /**
     * Converts each CSV row into bind values ordered like {@link TableSchema#insertColumns()}.
     * Rows with a blank gene id or an unconvertible cell are skipped.
     */
    List<Object[]> convertRows(TableSchema schema, DegTable table) {
        List<ColumnSpec> insertColumns = schema.insertColumns();
        List<Object[]> converted = new ArrayList<>(table.rows().size());
        int lineNumber = 1;
        for (List<String> cells : table.rows()) {
            lineNumber++;
            Object[] values = new Object[insertColumns.size()];
            try {
                for (int i = 0; i < insertColumns.size(); i++) {
                    ColumnSpec column = insertColumns.get(i);
                    values[i] = column.type().convert(cells.get(column.sourceIndex()), column.name());
                    if (column.primaryKey() && values[i] == null) {
                        throw new IllegalArgumentException("Blank " + RnaSeqConstants.COLUMN_GENE_ID);
                    }
                }
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping row {} of '{}': {}", lineNumber, schema.tableName(), ex.getMessage());
                continue;
            }
            converted.add(values);
        }
        return converted;
    }

    private void createTable(TableSchema schema) {
        String createSql = RnaSeqSql.createTable(schema);
        log.debug("Creating table:\n{}", createSql);
        String grantRole = rnaSeqProperties.getGrantRole();
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.execute(createSql);
            RnaSeqSql.createIndexes(schema).forEach(jdbcTemplate::execute);
            if (StringUtils.hasText(grantRole)) {
                jdbcTemplate.execute(RnaSeqSql.grant(schema, grantRole));
            }
        });
        log.info("Table '{}' ready", schema.tableName());
    }

    private void upsertRows(TableSchema schema, List<Object[]> rows) {
        String upsertSql = RnaSeqSql.upsert(schema, rnaSeqProperties.getConflictPolicy());
        log.debug("Upsert statement: {}", upsertSql);
        List<ColumnSpec> insertColumns = schema.insertColumns();
        transactionTemplate.executeWithoutResult(status -> jdbcTemplate.batchUpdate(
                upsertSql,
                rows,
                rnaSeqProperties.getBatchSize(),
                (PreparedStatement ps, Object[] values) -> bindRow(ps, insertColumns, values)
        ));
    }

    private void bindRow(PreparedStatement ps, List<ColumnSpec> insertColumns, Object[] values) throws SQLException {
        for (int i = 0; i < values.length; i++) {
            int jdbcType = insertColumns.get(i).type().jdbcType();
            if (values[i] == null) {
                ps.setNull(i + 1, jdbcType);
            } else {
                ps.setObject(i + 1, values[i], jdbcType);
            }
        }
    }

    private long countRows(String tableName) {
        Long count = jdbcTemplate.queryForObject(RnaSeqSql.countRows(tableName), Long.class);
        return count == null ? 0 : count;
    }

    private boolean containsCsv(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.anyMatch(file -> Files.isRegularFile(file)
                    && file.getFileName().toString().endsWith(RnaSeqConstants.FILE_EXT_CSV));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
