package com.genevis.migrations.enrichment;

import java.util.Map;

/**
 * Outcome of one enrichment migration run.
 *
 * @param recordsWritten rows upserted; stays 0 for a dry run
 * @param filesFailed    files whose transaction was rolled back
 * @param tableRowCount  row count re-queried after a live load, or -1 when not queried
 */
public record EnrichmentMigrationResult(
        Status status,
        boolean dryRun,
        int filesFound,
        int recordsParsed,
        int recordsWritten,
        int filesFailed,
        Map<String, Integer> recordsByComparison,
        long tableRowCount
) {

    public EnrichmentMigrationResult {
        recordsByComparison = recordsByComparison == null ? Map.of() : Map.copyOf(recordsByComparison);
    }

    static EnrichmentMigrationResult noFiles(boolean dryRun) {
        return new EnrichmentMigrationResult(Status.NO_FILES, dryRun, 0, 0, 0, 0, Map.of(), -1);
    }

    static EnrichmentMigrationResult noRecords(boolean dryRun, int filesFound) {
        return new EnrichmentMigrationResult(Status.NO_RECORDS, dryRun, filesFound, 0, 0, 0, Map.of(), -1);
    }

    /**
     * True when the run produced something usable: records to insert on a dry run, written rows otherwise.
     */
    public boolean producedOutput() {
        if (status != Status.COMPLETED) {
            return false;
        }
        return dryRun ? recordsParsed > 0 : recordsWritten > 0;
    }

    public enum Status {
        COMPLETED,
        NO_FILES,
        NO_RECORDS
    }
}
