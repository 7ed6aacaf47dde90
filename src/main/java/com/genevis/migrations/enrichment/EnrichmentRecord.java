package com.genevis.migrations.enrichment;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One pathway term of one comparison, keyed by (comparison, database, termId).
 */
public record EnrichmentRecord(
        String comparison,
        String database,
        String termId,
        String termDescription,
        int genesMapped,
        double enrichmentScore,
        String direction,
        double falseDiscoveryRate,
        String method,
        String matchingProteinIds,
        String matchingProteinLabels
) {

    /**
     * Column name to value view in table column order.
     */
    public Map<String, Object> toColumnValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("comparison", comparison);
        values.put("database", database);
        values.put("term_id", termId);
        values.put("term_description", termDescription);
        values.put("genes_mapped", genesMapped);
        values.put("enrichment_score", enrichmentScore);
        values.put("direction", direction);
        values.put("false_discovery_rate", falseDiscoveryRate);
        values.put("method", method);
        values.put("matching_protein_ids", matchingProteinIds);
        values.put("matching_protein_labels", matchingProteinLabels);
        return values;
    }
}
