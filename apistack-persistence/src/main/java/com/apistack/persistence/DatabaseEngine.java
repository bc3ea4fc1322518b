package com.apistack.persistence;

import java.util.Locale;

/**
 * Relational engines the gateway can be bound to. Exactly one is active per process.
 */
public enum DatabaseEngine {
    POSTGRES,
    ORACLE;

    public static DatabaseEngine fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Database engine must be configured");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "postgres":
            case "postgresql":
                return POSTGRES;
            case "oracle":
                return ORACLE;
            default:
                throw new IllegalArgumentException("Unsupported database engine: " + value);
        }
    }
}
