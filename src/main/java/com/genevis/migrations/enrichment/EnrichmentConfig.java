package com.genevis.migrations.enrichment;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of enrichment-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties(EnrichmentProperties.class)
public class EnrichmentConfig {
}
