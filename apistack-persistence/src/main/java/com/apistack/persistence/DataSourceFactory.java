package com.apistack.persistence;

import com.apistack.persistence.dialect.SqlDialect;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds the HikariCP pool for the configured engine.
 */
@Slf4j
public final class DataSourceFactory {

    private DataSourceFactory() {
    }

    public static HikariDataSource create(DatabaseSettings settings, SqlDialect dialect) {
        HikariConfig config = new HikariConfig();
        config.setPoolName(settings.getPoolName());

        String url = settings.getUrl();
        if (url == null || url.isBlank()) {
            config.setJdbcUrl(dialect.jdbcUrl(settings));
            config.setDriverClassName(dialect.driverClassName());
        } else {
            // explicit URL: the driver is resolved from it
            config.setJdbcUrl(url);
        }
        config.setUsername(settings.getUsername());
        config.setPassword(settings.getPassword());
        config.setMaximumPoolSize(settings.getMaxPoolSize());
        config.setMinimumIdle(Math.min(settings.getMinIdle(), settings.getMaxPoolSize()));
        config.setConnectionTimeout(settings.getConnectionTimeout().toMillis());
        config.setAutoCommit(false);

        log.info("Creating {} pool '{}' (max={}, checkoutTimeout={}ms)",
                dialect.engine(), settings.getPoolName(), settings.getMaxPoolSize(),
                settings.getConnectionTimeout().toMillis());
        return new HikariDataSource(config);
    }
}
