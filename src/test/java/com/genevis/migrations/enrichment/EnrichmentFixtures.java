package com.genevis.migrations.enrichment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes enrichment JSON files into a temporary source tree.
 */
final class EnrichmentFixtures {

    private EnrichmentFixtures() {
    }

    static Path writeFile(Path root, String comparison, String fileName, String json) throws IOException {
        Path dir = Files.createDirectories(root.resolve(comparison));
        return Files.writeString(dir.resolve(fileName), json);
    }

    static String term(String termId, String description, double fdr) {
        return """
                {"#term ID": "%s", "term description": "%s", "genes mapped": 12, "enrichment score": 1.75,
                 "direction": "top", "false discovery rate": %s, "method": "ks",
                 "matching proteins in your input (IDs)": ["9606.ENSP1", "9606.ENSP2"],
                 "matching proteins in your input (labels)": ["TP53", "MYC"]}
                """.formatted(termId, description, fdr);
    }

    static String array(String... elements) {
        return "[" + String.join(",", elements) + "]";
    }
}
