package com.genevis.migrations.enrichment;

import java.nio.file.Path;

/**
 * One discovered enrichment file with the comparison and canonical database it belongs to.
 */
public record EnrichmentFile(Path path, String comparison, String database) {
}
