package com.genevis.migrations.rnaseq;

import java.util.List;

/**
 * Outcome of migrating one comparison.
 *
 * @param rowsSkipped   data rows rejected during conversion (blank gene id, bad cell)
 * @param rowsWritten   rows upserted; stays 0 for a dry run or a failed comparison
 * @param tableRowCount row count re-queried after the upsert, or -1 when not queried
 * @param failureReason null unless {@code success} is false
 */
public record RnaSeqMigrationResult(
        String comparison,
        boolean success,
        boolean dryRun,
        int rowsRead,
        int rowsSkipped,
        int rowsWritten,
        long tableRowCount,
        List<String> droppedColumns,
        String failureReason
) {

    public RnaSeqMigrationResult {
        droppedColumns = droppedColumns == null ? List.of() : List.copyOf(droppedColumns);
    }

    static RnaSeqMigrationResult failed(String comparison, boolean dryRun, String reason) {
        return new RnaSeqMigrationResult(comparison, false, dryRun, 0, 0, 0, -1, List.of(), reason);
    }
}
