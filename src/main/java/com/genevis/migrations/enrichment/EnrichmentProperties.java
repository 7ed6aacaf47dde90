package com.genevis.migrations.enrichment;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Externalized enrichment migration configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "migration.enrichment")
public class EnrichmentProperties {

    private String sourceDir = EnrichmentConstants.DEFAULT_SOURCE_DIR;
    private String tableName = EnrichmentConstants.DEFAULT_TABLE;
    private int batchSize = EnrichmentConstants.DEFAULT_BATCH_SIZE;
    private String testDirectoryMarker = EnrichmentConstants.DEFAULT_TEST_DIRECTORY_MARKER;
    private Map<String, String> databaseAliases = new LinkedHashMap<>(EnrichmentConstants.DEFAULT_DATABASE_ALIASES);

    public String getSourceDir() {
        return sourceDir;
    }

    public void setSourceDir(String sourceDir) {
        this.sourceDir = sourceDir;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public String getTestDirectoryMarker() {
        return testDirectoryMarker;
    }

    public void setTestDirectoryMarker(String testDirectoryMarker) {
        this.testDirectoryMarker = testDirectoryMarker;
    }

    public Map<String, String> getDatabaseAliases() {
        return databaseAliases;
    }

    public void setDatabaseAliases(Map<String, String> databaseAliases) {
        this.databaseAliases = databaseAliases;
    }
}
