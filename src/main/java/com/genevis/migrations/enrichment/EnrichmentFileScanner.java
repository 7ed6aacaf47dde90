package com.genevis.migrations.enrichment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Finds {@code <root>/<comparison>/enrichment.<database>.json} files and classifies each one.
 */
@Component
public class EnrichmentFileScanner {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentFileScanner.class);

    private final EnrichmentProperties enrichmentProperties;

    public EnrichmentFileScanner(EnrichmentProperties enrichmentProperties) {
        this.enrichmentProperties = enrichmentProperties;
    }

    /**
     * Returns discovered files ordered by comparison directory name, then file name.
     * Directories whose name contains the test marker are skipped, as are files whose
     * name is not exactly {@code enrichment.<token>.json}.
     */
    public List<EnrichmentFile> scan(Path rootDir) {
        if (rootDir == null || !Files.isDirectory(rootDir)) {
            throw new IllegalStateException(EnrichmentConstants.MSG_SOURCE_DIR_NOT_FOUND.formatted(rootDir));
        }

        String testMarker = enrichmentProperties.getTestDirectoryMarker().toLowerCase(Locale.ROOT);
        List<EnrichmentFile> files = new ArrayList<>();

        for (Path comparisonDir : sortedChildren(rootDir)) {
            if (!Files.isDirectory(comparisonDir)) {
                continue;
            }
            String comparison = comparisonDir.getFileName().toString();
            if (!testMarker.isEmpty() && comparison.toLowerCase(Locale.ROOT).contains(testMarker)) {
                log.debug("Skipping test directory: {}", comparison);
                continue;
            }

            for (Path jsonFile : sortedChildren(comparisonDir)) {
                String fileName = jsonFile.getFileName().toString();
                if (!Files.isRegularFile(jsonFile) || !isEnrichmentFileName(fileName)) {
                    continue;
                }

                String[] stemTokens = stem(fileName).split("\\.", -1);
                if (stemTokens.length != EnrichmentConstants.FILE_STEM_TOKENS || stemTokens[1].isEmpty()) {
                    log.debug("Skipping file with unexpected name: {}", fileName);
                    continue;
                }

                String database = resolveDatabase(stemTokens[1]);
                files.add(new EnrichmentFile(jsonFile, comparison, database));
                log.debug("Found: {} / {}", comparison, database);
            }
        }
        return files;
    }

    /**
     * Maps a raw filename token to its canonical database name; unknown tokens pass through.
     */
    String resolveDatabase(String rawDatabase) {
        return enrichmentProperties.getDatabaseAliases().getOrDefault(rawDatabase, rawDatabase);
    }

    private boolean isEnrichmentFileName(String fileName) {
        return fileName.startsWith(EnrichmentConstants.FILE_PREFIX)
                && fileName.endsWith(EnrichmentConstants.FILE_SUFFIX)
                && fileName.length() > EnrichmentConstants.FILE_PREFIX.length() + EnrichmentConstants.FILE_SUFFIX.length();
    }

    private String stem(String fileName) {
        return fileName.substring(0, fileName.length() - EnrichmentConstants.FILE_SUFFIX.length());
    }

    private List<Path> sortedChildren(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.sorted(Comparator.comparing(path -> path.getFileName().toString())).toList();
        } catch (IOException ex) {
            throw new IllegalStateException(EnrichmentConstants.MSG_SOURCE_DIR_READ_FAILED.formatted(dir), ex);
        }
    }
}
