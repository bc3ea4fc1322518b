package com.apistack.persistence.dialect;

import com.apistack.common.exception.DataException;
import com.apistack.persistence.DatabaseEngine;
import com.apistack.persistence.DatabaseSettings;

import java.sql.SQLException;
import java.util.Locale;

/**
 * PostgreSQL: lower-case folding, LIMIT/OFFSET paging, native booleans and UUIDs, pgvector available.
 */
public class PostgresDialect extends AbstractSqlDialect {

    @Override
    public DatabaseEngine engine() {
        return DatabaseEngine.POSTGRES;
    }

    @Override
    public String driverClassName() {
        return "org.postgresql.Driver";
    }

    @Override
    public String jdbcUrl(DatabaseSettings settings) {
        return "jdbc:postgresql://" + settings.getHost() + ":" + settings.getPort() + "/" + settings.getDatabase();
    }

    @Override
    public String validationQuery() {
        return "SELECT 1";
    }

    @Override
    public String foldCase(String identifier) {
        requireIdentifier(identifier);
        return identifier.toLowerCase(Locale.ROOT);
    }

    @Override
    public String paginate(String sql, long offset, int limit) {
        requirePage(offset, limit);
        return sql + " LIMIT " + limit + " OFFSET " + offset;
    }

    @Override
    protected DataException.Kind classifyVendor(SQLException e) {
        String state = e.getSQLState();
        if (state == null) {
            return DataException.Kind.OTHER;
        }
        switch (state) {
            case "23505": // unique_violation
            case "23503": // foreign_key_violation
            case "40001": // serialization_failure
            case "40P01": // deadlock_detected
                return DataException.Kind.CONFLICT;
            case "57014": // query_canceled, raised by statement_timeout
                return DataException.Kind.TIMEOUT;
            case "57P01":
            case "57P02":
            case "57P03":
                return DataException.Kind.CONNECTION_LOST;
            default:
                return DataException.Kind.OTHER;
        }
    }

    @Override
    public boolean supportsVectorSearch() {
        return true;
    }
}
