package com.apistack.persistence.dialect;

import com.apistack.common.exception.DataException;
import com.apistack.persistence.DatabaseEngine;
import com.apistack.persistence.DatabaseSettings;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Everything that differs between the supported engines.
 * Callers above the gateway never branch on the engine; they go through this contract.
 */
public interface SqlDialect {

    DatabaseEngine engine();

    String driverClassName();

    String jdbcUrl(DatabaseSettings settings);

    /**
     * Cheap statement used by readiness checks.
     */
    String validationQuery();

    /**
     * Fold an unquoted identifier the way the engine stores it.
     */
    String foldCase(String identifier);

    /**
     * Quote an identifier, escaping embedded quotes. No case folding is applied.
     */
    String quoteIdentifier(String identifier);

    /**
     * Append the engine's pagination clause to a query that already has its ORDER BY.
     */
    String paginate(String sql, long offset, int limit);

    void bind(PreparedStatement statement, int index, Object value) throws SQLException;

    DataException.Kind classify(SQLException e);

    default DataException translate(SQLException e, String message) {
        return new DataException(classify(e), message, e);
    }

    boolean supportsVectorSearch();
}
