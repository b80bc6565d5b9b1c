package com.mimecast.directoryauth.db;

import com.mimecast.directoryauth.config.DirectoryAuthConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * DataSourceFactory builds the HikariDataSource backing the bookkeeping tables
 * from the <code>sql</code> section of the backend configuration.
 *
 * <p>Each backend instance owns its data source and closes it on shutdown.
 */
public final class DataSourceFactory {
    private static final Logger log = LogManager.getLogger(DataSourceFactory.class);

    /**
     * Hikari refuses lifetimes under 30 seconds.
     */
    private static final long MIN_LIFETIME_SECONDS = 30L;

    private DataSourceFactory() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Creates a data source.
     *
     * @param config Backend configuration.
     * @return HikariDataSource instance or null when no JDBC URL is configured.
     */
    public static HikariDataSource create(DirectoryAuthConfig config) {
        String jdbcUrl = config.getSqlJdbcUrl();
        if (StringUtils.isBlank(jdbcUrl)) {
            log.info("No SQL database configured");
            return null;
        }

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl(jdbcUrl);
        cfg.setUsername(config.getSqlUser());
        cfg.setPassword(config.getSqlPassword());
        cfg.setMaximumPoolSize(Math.max(1, config.getSqlPoolSize()));
        cfg.setMaxLifetime(TimeUnit.SECONDS.toMillis(Math.max(MIN_LIFETIME_SECONDS, config.getSqlPoolRecycle())));
        cfg.setPoolName("DirectoryAuthPool");

        try {
            HikariDataSource ds = new HikariDataSource(cfg);
            log.info("Initialized HikariDataSource for directory auth bookkeeping: {}", jdbcUrl);
            return ds;
        } catch (RuntimeException e) {
            log.error("Failed to initialize datasource {}: {}", jdbcUrl, e.getMessage());
            throw e;
        }
    }
}
