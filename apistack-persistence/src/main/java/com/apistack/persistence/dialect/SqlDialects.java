package com.apistack.persistence.dialect;

import com.apistack.persistence.DatabaseEngine;

/**
 * The single place where the configured engine is turned into behavior.
 */
public final class SqlDialects {

    private SqlDialects() {
    }

    public static SqlDialect forEngine(DatabaseEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("Database engine must be configured");
        }
        switch (engine) {
            case POSTGRES:
                return new PostgresDialect();
            case ORACLE:
                return new OracleDialect();
            default:
                throw new IllegalArgumentException("Unsupported database engine: " + engine);
        }
    }
}
