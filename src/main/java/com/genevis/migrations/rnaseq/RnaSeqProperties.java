package com.genevis.migrations.rnaseq;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized RNA-seq migration configuration bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "migration.rnaseq")
public class RnaSeqProperties {

    private String sourceDir = RnaSeqConstants.DEFAULT_SOURCE_DIR;
    private String samplePrefix = RnaSeqConstants.DEFAULT_SAMPLE_PREFIX;
    private int batchSize = RnaSeqConstants.DEFAULT_BATCH_SIZE;
    private String grantRole = RnaSeqConstants.DEFAULT_GRANT_ROLE;
    private ConflictPolicy conflictPolicy = ConflictPolicy.REFRESH_ALL;
    private boolean failOnUnrecognizedColumns;

    public String getSourceDir() {
        return sourceDir;
    }

    public void setSourceDir(String sourceDir) {
        this.sourceDir = sourceDir;
    }

    public String getSamplePrefix() {
        return samplePrefix;
    }

    public void setSamplePrefix(String samplePrefix) {
        this.samplePrefix = samplePrefix;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public String getGrantRole() {
        return grantRole;
    }

    public void setGrantRole(String grantRole) {
        this.grantRole = grantRole;
    }

    public ConflictPolicy getConflictPolicy() {
        return conflictPolicy;
    }

    public void setConflictPolicy(ConflictPolicy conflictPolicy) {
        this.conflictPolicy = conflictPolicy;
    }

    public boolean isFailOnUnrecognizedColumns() {
        return failOnUnrecognizedColumns;
    }

    public void setFailOnUnrecognizedColumns(boolean failOnUnrecognizedColumns) {
        this.failOnUnrecognizedColumns = failOnUnrecognizedColumns;
    }
}
