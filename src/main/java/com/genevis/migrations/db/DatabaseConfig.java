package com.genevis.migrations.db;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Builds the single-connection pool used by both migrations. The pool opens no connection
 * until the first write, so dry runs never touch the database.
 */
@Configuration
@EnableConfigurationProperties(DatabaseProperties.class)
public class DatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    @Bean
    public DataSource dataSource(DatabaseProperties databaseProperties) {
        log.debug("Database target: {}", databaseProperties.describe());
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .driverClassName("org.postgresql.Driver")
                .url(databaseProperties.jdbcUrl())
                .username(databaseProperties.getUsername())
                .password(databaseProperties.getPassword())
                .build();
        dataSource.setPoolName("migration");
        dataSource.setMaximumPoolSize(1);
        dataSource.setMinimumIdle(0);
        return dataSource;
    }
}
