package com.apistack.persistence;

import com.apistack.common.exception.DataException;
import com.apistack.persistence.dialect.SqlDialect;
import com.apistack.persistence.vector.PgVectorSearch;
import com.apistack.persistence.vector.VectorSearch;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;

/**
 * Data access gateway over a pooled JDBC data source.
 * Connection checkout is retried once after a short backoff when it fails with a transient kind;
 * statements inside a transaction are never retried.
 */
@Slf4j
public class JdbcDataAccessGateway implements DataAccessGateway {

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final int queryTimeoutSeconds;
    private final Duration acquireRetryBackoff;
    private final VectorSearch vectorSearch;

    public JdbcDataAccessGateway(DataSource dataSource, SqlDialect dialect, DatabaseSettings settings) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.queryTimeoutSeconds = (int) settings.getStatementTimeout().toSeconds();
        this.acquireRetryBackoff = settings.getAcquireRetryBackoff();
        this.vectorSearch = dialect.supportsVectorSearch() ? new PgVectorSearch(this, dialect) : null;
        log.info("Data access gateway bound to {}", dialect.engine());
    }

    @Override
    public <T> T withTransaction(TransactionCallback<T> callback) {
        return withTransaction(CancellationSignal.none(), callback);
    }

    @Override
    public <T> T withTransaction(CancellationSignal signal, TransactionCallback<T> callback) {
        if (signal.isCancelled()) {
            throw cancelled(null);
        }

        Connection connection = acquire();
        JdbcConnectionHandle handle = new JdbcConnectionHandle(connection, dialect, queryTimeoutSeconds, signal);
        Runnable deregister = signal.onCancel(handle::cancelRunning);
        try {
            connection.setAutoCommit(false);
            T result = callback.doInTransaction(handle);
            if (signal.isCancelled()) {
                throw cancelled(null);
            }
            connection.commit();
            return result;
        } catch (SQLException e) {
            rollback(connection, e);
            if (signal.isCancelled()) {
                throw cancelled(e);
            }
            throw dialect.translate(e, "Transaction failed");
        } catch (RuntimeException | Error e) {
            rollback(connection, e);
            throw e;
        } finally {
            deregister.run();
            handle.close();
            release(connection);
        }
    }

    @Override
    public Optional<VectorSearch> vectorSearch() {
        return Optional.ofNullable(vectorSearch);
    }

    @Override
    public DatabaseEngine engine() {
        return dialect.engine();
    }

    @Override
    public boolean ping() {
        try {
            return withTransaction(handle -> !handle.query(dialect.validationQuery(), rs -> rs.getInt(1)).isEmpty());
        } catch (DataException e) {
            log.warn("Database ping failed: kind={}, message={}", e.getKind(), e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) dataSource).close();
                log.info("Closed connection pool for {}", dialect.engine());
            } catch (Exception e) {
                log.warn("Error closing connection pool", e);
            }
        }
    }

    private Connection acquire() {
        try {
            return dataSource.getConnection();
        } catch (SQLException first) {
            DataException.Kind kind = dialect.classify(first);
            if (!kind.isTransient()) {
                throw new DataException(kind, "Failed to acquire connection", first);
            }
            log.warn("Connection checkout failed with {}, retrying once in {} ms", kind, acquireRetryBackoff.toMillis());
            sleep(acquireRetryBackoff, first);
            try {
                return dataSource.getConnection();
            } catch (SQLException second) {
                second.addSuppressed(first);
                throw new DataException(dialect.classify(second), "Failed to acquire connection after retry", second);
            }
        }
    }

    private static void sleep(Duration backoff, SQLException cause) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataException(DataException.Kind.TIMEOUT, "Interrupted while waiting to retry checkout", cause);
        }
    }

    private static void rollback(Connection connection, Throwable cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private static void release(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to release connection: {}", e.getMessage());
        }
    }

    private static DataException cancelled(SQLException cause) {
        return new DataException(DataException.Kind.OTHER, "Unit of work was cancelled", cause);
    }
}
