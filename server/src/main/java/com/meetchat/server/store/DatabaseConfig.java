package com.meetchat.server.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * HikariCP pool for {@link JdbcChatStore}.
 */
public class DatabaseConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    private final String url;
    private final String username;
    private final String password;
    private final String driver;

    // Connection pool settings
    private final int maximumPoolSize;
    private final int minimumIdle;
    private final long connectionTimeout;
    private final long idleTimeout;
    private final long maxLifetime;

    private HikariDataSource dataSource;

    public DatabaseConfig(String url, String username, String password, String driver,
                          int maximumPoolSize, int minimumIdle,
                          long connectionTimeout, long idleTimeout, long maxLifetime) {
        this.url = url;
        this.username = username;
        this.password = password;
        this.driver = driver;
        this.maximumPoolSize = maximumPoolSize;
        this.minimumIdle = minimumIdle;
        this.connectionTimeout = connectionTimeout;
        this.idleTimeout = idleTimeout;
        this.maxLifetime = maxLifetime;
    }

    /**
     * Initialize HikariCP DataSource
     */
    public void initialize() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("meetchat-db");
        config.setJdbcUrl(url);
        config.setUsername(username);
        config.setPassword(password);
        if (driver != null && !driver.isBlank()) {
            config.setDriverClassName(driver);
        }

        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(minimumIdle);
        config.setConnectionTimeout(connectionTimeout);
        config.setIdleTimeout(idleTimeout);
        config.setMaxLifetime(maxLifetime);

        if (url.startsWith("jdbc:mysql:")) {
            config.addDataSourceProperty("cachePrepStmts", "true");
            config.addDataSourceProperty("prepStmtCacheSize", "250");
            config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
            config.addDataSourceProperty("useServerPrepStmts", "true");
        }

        this.dataSource = new HikariDataSource(config);

        log.info("Database connection pool initialized: url={}, poolSize={}, minIdle={}",
                url, maximumPoolSize, minimumIdle);
    }

    public DataSource getDataSource() {
        if (dataSource == null) {
            throw new IllegalStateException("DataSource not initialized. Call initialize() first.");
        }
        return dataSource;
    }

    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database connection pool closed");
        }
    }

    /**
     * Runs a classpath SQL script, one statement per {@code ;}. Scripts are expected to be
     * idempotent (CREATE ... IF NOT EXISTS).
     */
    public static void runScript(DataSource dataSource, String resource) {
        String sql;
        try (InputStream in = DatabaseConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Schema script not found: " + resource);
            }
            sql = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + resource, e);
        }

        int n = 0;
        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            for (String stmt : sql.split(";")) {
                if (stmt.isBlank()) continue;
                st.execute(stmt.trim());
                n++;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Schema script failed: " + resource, e);
        }
        log.info("Applied {} ({} statements)", resource, n);
    }
}
