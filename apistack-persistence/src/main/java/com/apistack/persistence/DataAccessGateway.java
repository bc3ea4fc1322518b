package com.apistack.persistence;

import com.apistack.persistence.vector.VectorSearch;

import java.util.Optional;

/**
 * Engine-agnostic unit-of-work entry point.
 *
 * <p>The callback runs on one pooled connection inside one transaction. A normal return commits,
 * any exception rolls back, and the connection is released before this method returns.
 * Driver errors surface as {@link com.apistack.common.exception.DataException} with a normalized kind.
 */
public interface DataAccessGateway extends AutoCloseable {

    <T> T withTransaction(TransactionCallback<T> callback);

    <T> T withTransaction(CancellationSignal signal, TransactionCallback<T> callback);

    /**
     * Present only when the active engine supports similarity search.
     */
    Optional<VectorSearch> vectorSearch();

    DatabaseEngine engine();

    /**
     * @return true when a connection can be checked out and the validation query succeeds
     */
    boolean ping();

    @Override
    void close();
}
