package org.croniq.config.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jetbrains.annotations.NotNull;
import org.croniq.config.XmlConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Owns the HikariCP pool. The pool is created even when the database is unreachable at
 * startup; in that case the service runs degraded and Hikari keeps retrying on each borrow.
 */
public class DatabaseManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseManager.class);

    private final HikariDataSource dataSource;

    public DatabaseManager(XmlConfiguration cfg) {
        if (cfg == null || cfg.dataSource == null || cfg.dataSource.jdbcUrl == null) {
            throw new IllegalArgumentException("Invalid configuration: missing dataSource section or jdbcUrl.");
        }
        logger.info("Initializing connection pool for {}", cfg.dataSource.jdbcUrl);
        HikariConfig hc = getHikariConfig(cfg);

        if (cfg.dataSource.encrypt) {
            hc.addDataSourceProperty("ssl", "true");
            hc.addDataSourceProperty("sslmode", "require");
            logger.info("SSL enabled for PostgreSQL connection");
        } else {
            hc.addDataSourceProperty("ssl", "false");
            logger.info("SSL disabled for PostgreSQL connection");
        }

        this.dataSource = new HikariDataSource(hc);
    }

    @NotNull
    private static HikariConfig getHikariConfig(XmlConfiguration cfg) {
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("croniq-pool");
        hc.setJdbcUrl(cfg.dataSource.jdbcUrl);
        hc.setUsername(cfg.dataSource.username);
        hc.setPassword(cfg.dataSource.password);
        hc.setDriverClassName(
                cfg.dataSource.driverClassName != null
                        ? cfg.dataSource.driverClassName
                        : "org.postgresql.Driver"
        );
        hc.setMaximumPoolSize(cfg.connectionPool.maximumPoolSize);
        hc.setMinimumIdle(cfg.connectionPool.minimumIdle);
        hc.setIdleTimeout(cfg.connectionPool.idleTimeout);
        hc.setConnectionTimeout(cfg.connectionPool.connectionTimeout);
        hc.setMaxLifetime(cfg.connectionPool.maxLifetime);
        // start even if the database is down
        hc.setInitializationFailTimeout(-1);
        return hc;
    }

    /**
     * @return true when a pooled connection can be borrowed and validated
     */
    public boolean isAvailable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            logger.debug("Database availability check failed: {}", e.getMessage());
            return false;
        }
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            logger.info("Database connection pool shut down.");
        }
    }
}
