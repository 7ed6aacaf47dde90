package com.genevis.migrations.enrichment;

/**
 * Switches for one enrichment migration run.
 */
public record EnrichmentOptions(boolean dryRun, boolean clear) {
}
