package com.genevis.migrations.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;

import javax.sql.DataSource;

/**
 * Starts one PostgreSQL container per test class. Subclasses carry
 * {@code @Testcontainers(disabledWithoutDocker = true)} so they skip where Docker is absent.
 */
public abstract class PostgresTestBase {
    protected static PostgreSQLContainer<?> pg;
    protected static HikariDataSource ds;

    @BeforeAll
    static void startPg() {
        pg = new PostgreSQLContainer<>("postgres:16")
                .withDatabaseName("gene_visualizations")
                .withUsername("gene_admin")
                .withPassword("gene_pw");
        pg.start();

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(pg.getJdbcUrl());
        cfg.setUsername(pg.getUsername());
        cfg.setPassword(pg.getPassword());
        cfg.setMaximumPoolSize(2);
        cfg.setMinimumIdle(1);
        ds = new HikariDataSource(cfg);
    }

    @AfterAll
    static void stopPg() {
        if (ds != null) ds.close();
        if (pg != null) pg.stop();
    }

    protected DataSource dataSource() {
        return ds;
    }

    protected JdbcTemplate jdbcTemplate() {
        return new JdbcTemplate(ds);
    }

    protected TransactionTemplate transactionTemplate() {
        return new TransactionTemplate(new DataSourceTransactionManager(ds));
    }
}
