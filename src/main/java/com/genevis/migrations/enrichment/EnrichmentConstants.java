package com.genevis.migrations.enrichment;

import java.util.Map;

/**
 * Shared constants for the enrichment migration.
 */
public final class EnrichmentConstants {

    private EnrichmentConstants() {
    }

    public static final String DEFAULT_SOURCE_DIR = "src/barCharts";
    public static final String DEFAULT_TABLE = "enrichment_data";
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final String DEFAULT_TEST_DIRECTORY_MARKER = "test";
    public static final Map<String, String> DEFAULT_DATABASE_ALIASES = Map.of(
            "KEGG", "KEGG",
            "RCTM", "Reactome",
            "WikiPathways", "WikiPathways"
    );

    public static final String FILE_PREFIX = "enrichment.";
    public static final String FILE_SUFFIX = ".json";
    public static final int FILE_STEM_TOKENS = 2;

    public static final String KEY_TERM_ID = "#term ID";
    public static final String KEY_TERM_DESCRIPTION = "term description";
    public static final String KEY_GENES_MAPPED = "genes mapped";
    public static final String KEY_ENRICHMENT_SCORE = "enrichment score";
    public static final String KEY_DIRECTION = "direction";
    public static final String KEY_FALSE_DISCOVERY_RATE = "false discovery rate";
    public static final String KEY_METHOD = "method";
    public static final String KEY_MATCHING_PROTEIN_IDS = "matching proteins in your input (IDs)";
    public static final String KEY_MATCHING_PROTEIN_LABELS = "matching proteins in your input (labels)";

    public static final int DEFAULT_GENES_MAPPED = 0;
    public static final double DEFAULT_ENRICHMENT_SCORE = 0.0;
    public static final double DEFAULT_FALSE_DISCOVERY_RATE = 1.0;
    public static final String LIST_SEPARATOR = ",";

    public static final int SAMPLE_VALUE_MAX_LENGTH = 80;

    public static final String MSG_SOURCE_DIR_NOT_FOUND = "Source directory not found: %s";
    public static final String MSG_SOURCE_DIR_READ_FAILED = "Unable to list source directory: %s";
    public static final String MSG_INVALID_JSON = "Invalid JSON in {}: {}";
    public static final String MSG_READ_FAILED = "Error reading {}: {}";
    public static final String MSG_NOT_AN_ARRAY = "Expected array in {}, got {}";
}
