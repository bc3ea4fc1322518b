package com.apistack.persistence;

import com.apistack.common.exception.DataException;
import com.apistack.persistence.dialect.SqlDialect;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statement execution over a single JDBC connection. Tracks the running statement so it can be cancelled.
 */
@Slf4j
class JdbcConnectionHandle implements ConnectionHandle {

    private final Connection connection;
    private final SqlDialect dialect;
    private final int queryTimeoutSeconds;
    private final CancellationSignal signal;

    private volatile PreparedStatement running;
    private volatile boolean closed;

    JdbcConnectionHandle(Connection connection, SqlDialect dialect, int queryTimeoutSeconds, CancellationSignal signal) {
        this.connection = connection;
        this.dialect = dialect;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.signal = signal;
    }

    @Override
    public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) throws SQLException {
        try (PreparedStatement statement = prepare(sql, params)) {
            try (ResultSet rs = statement.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        } finally {
            running = null;
        }
    }

    @Override
    public <T> T queryOne(String sql, RowMapper<T> mapper, Object... params) throws SQLException {
        return queryOptional(sql, mapper, params)
                .orElseThrow(() -> new DataException(DataException.Kind.NOT_FOUND, "No row matched the query"));
    }

    @Override
    public <T> Optional<T> queryOptional(String sql, RowMapper<T> mapper, Object... params) throws SQLException {
        List<T> rows = query(sql, mapper, params);
        if (rows.size() > 1) {
            throw new DataException(DataException.Kind.CONFLICT, "Expected at most one row but got " + rows.size());
        }
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    @Override
    public int update(String sql, Object... params) throws SQLException {
        try (PreparedStatement statement = prepare(sql, params)) {
            return statement.executeUpdate();
        } finally {
            running = null;
        }
    }

    @Override
    public void updateExactlyOne(String sql, Object... params) throws SQLException {
        int count = update(sql, params);
        if (count == 0) {
            throw new DataException(DataException.Kind.NOT_FOUND, "No row was updated");
        }
        if (count > 1) {
            throw new DataException(DataException.Kind.CONFLICT, "Expected one updated row but got " + count);
        }
    }

    @Override
    public String quote(String identifier) {
        return dialect.quoteIdentifier(dialect.foldCase(identifier));
    }

    @Override
    public String paginate(String sql, long offset, int limit) {
        return dialect.paginate(sql, offset, limit);
    }

    @Override
    public SqlDialect dialect() {
        return dialect;
    }

    void cancelRunning() {
        PreparedStatement statement = running;
        if (statement == null) {
            return;
        }
        try {
            statement.cancel();
            log.debug("Cancelled running statement");
        } catch (SQLException e) {
            log.warn("Failed to cancel running statement: {}", e.getMessage());
        }
    }

    void close() {
        closed = true;
    }

    private PreparedStatement prepare(String sql, Object... params) throws SQLException {
        if (closed) {
            throw new IllegalStateException("Connection handle used outside its transaction");
        }
        if (signal.isCancelled()) {
            throw new DataException(DataException.Kind.OTHER, "Unit of work was cancelled");
        }
        PreparedStatement statement = connection.prepareStatement(sql);
        try {
            if (queryTimeoutSeconds > 0) {
                statement.setQueryTimeout(queryTimeoutSeconds);
            }
            for (int i = 0; i < params.length; i++) {
                dialect.bind(statement, i + 1, params[i]);
            }
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
        running = statement;
        return statement;
    }
}
