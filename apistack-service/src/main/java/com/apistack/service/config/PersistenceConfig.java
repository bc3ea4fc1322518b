package com.apistack.service.config;

import com.apistack.persistence.DataAccessGateway;
import com.apistack.persistence.DataSourceFactory;
import com.apistack.persistence.DatabaseEngine;
import com.apistack.persistence.DatabaseSettings;
import com.apistack.persistence.JdbcDataAccessGateway;
import com.apistack.persistence.dialect.SqlDialect;
import com.apistack.persistence.dialect.SqlDialects;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the data access gateway to the one engine selected by {@code apistack.database.engine}.
 * An unknown engine fails startup; there is no fallback to the other engine.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public SqlDialect sqlDialect(ApiStackProperties properties) {
        return SqlDialects.forEngine(DatabaseEngine.fromConfig(properties.getDatabase().getEngine()));
    }

    @Bean(destroyMethod = "close")
    public DataAccessGateway dataAccessGateway(ApiStackProperties properties, SqlDialect dialect) {
        DatabaseSettings settings = settings(properties.getDatabase(), dialect.engine());
        return new JdbcDataAccessGateway(DataSourceFactory.create(settings, dialect), dialect, settings);
    }

    static DatabaseSettings settings(ApiStackProperties.DatabaseConfig config, DatabaseEngine engine) {
        ApiStackProperties.EndpointConfig endpoint =
                engine == DatabaseEngine.ORACLE ? config.getOracle() : config.getPostgres();
        ApiStackProperties.PoolConfig pool = config.getPool();
        return DatabaseSettings.builder()
                .engine(engine)
                .url(config.getUrl())
                .host(endpoint.getHost())
                .port(endpoint.getPort())
                .database(endpoint.getDatabase())
                .username(endpoint.getUsername())
                .password(endpoint.getPassword())
                .maxPoolSize(pool.getMaxSize())
                .minIdle(pool.getMinIdle())
                .connectionTimeout(pool.getTimeout())
                .acquireRetryBackoff(pool.getRetryBackoff())
                .statementTimeout(config.getStatementTimeout())
                .poolName("apistack-" + engine.name().toLowerCase())
                .build();
    }
}
