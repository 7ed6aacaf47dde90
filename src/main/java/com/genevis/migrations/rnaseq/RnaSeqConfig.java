package com.genevis.migrations.rnaseq;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of RNA-seq-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties(RnaSeqProperties.class)
public class RnaSeqConfig {
}
