package com.genevis.migrations.db;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings bound from {@code db.*}; each key can also come from the matching
 * {@code DB_*} environment variable or a {@code --db.*} command-line flag.
 */
@ConfigurationProperties(prefix = "db")
public class DatabaseProperties {

    private String host = "localhost";
    private int port = 5431;
    private String name = "gene_visualizations";
    private String username = "gene_admin";
    private String password = "";
    private String sslmode = "prefer";

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getSslmode() {
        return sslmode;
    }

    public void setSslmode(String sslmode) {
        this.sslmode = sslmode;
    }

    /**
     * Builds the PostgreSQL JDBC URL for the configured host, port, database and TLS mode.
     */
    public String jdbcUrl() {
        return "jdbc:postgresql://%s:%d/%s?sslmode=%s".formatted(host, port, name, sslmode);
    }

    /**
     * Connection target without credentials, for log output.
     */
    public String describe() {
        return "%s @ %s:%d".formatted(name, host, port);
    }
}
