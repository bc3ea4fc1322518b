package com.apistack.persistence.dialect;

import com.apistack.common.exception.DataException;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.UUID;

/**
 * Shared quoting, binding and error classification. Subclasses override the engine-specific parts.
 */
public abstract class AbstractSqlDialect implements SqlDialect {

    @Override
    public String quoteIdentifier(String identifier) {
        requireIdentifier(identifier);
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public void bind(PreparedStatement statement, int index, Object value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.NULL);
        } else if (value instanceof Boolean) {
            bindBoolean(statement, index, (Boolean) value);
        } else if (value instanceof UUID) {
            bindUuid(statement, index, (UUID) value);
        } else if (value instanceof Instant) {
            statement.setTimestamp(index, Timestamp.from((Instant) value));
        } else if (value instanceof Enum<?>) {
            statement.setString(index, ((Enum<?>) value).name());
        } else {
            statement.setObject(index, value);
        }
    }

    protected void bindBoolean(PreparedStatement statement, int index, boolean value) throws SQLException {
        statement.setBoolean(index, value);
    }

    protected void bindUuid(PreparedStatement statement, int index, UUID value) throws SQLException {
        statement.setObject(index, value);
    }

    @Override
    public DataException.Kind classify(SQLException e) {
        SQLException current = e;
        while (current != null) {
            DataException.Kind kind = classifyOne(current);
            if (kind != DataException.Kind.OTHER) {
                return kind;
            }
            current = current.getNextException();
        }
        return DataException.Kind.OTHER;
    }

    private DataException.Kind classifyOne(SQLException e) {
        // Hikari reports pool exhaustion as a transient connection exception
        if (e instanceof SQLTimeoutException || e instanceof SQLTransientConnectionException) {
            return DataException.Kind.TIMEOUT;
        }
        if (e instanceof SQLRecoverableException || e instanceof SQLNonTransientConnectionException) {
            return DataException.Kind.CONNECTION_LOST;
        }

        DataException.Kind specific = classifyVendor(e);
        if (specific != DataException.Kind.OTHER) {
            return specific;
        }

        String state = e.getSQLState();
        if (state != null && state.length() >= 2) {
            switch (state.substring(0, 2)) {
                case "23":
                case "40":
                    return DataException.Kind.CONFLICT;
                case "08":
                    return DataException.Kind.CONNECTION_LOST;
                default:
                    break;
            }
        }
        return DataException.Kind.OTHER;
    }

    /**
     * Engine-specific mapping of SQLState or vendor codes. Return OTHER to fall back to the SQLState class.
     */
    protected abstract DataException.Kind classifyVendor(SQLException e);

    protected static void requireIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be blank");
        }
    }

    protected static void requirePage(long offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
    }
}
