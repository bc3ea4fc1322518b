package com.apistack.persistence;

import java.sql.SQLException;

/**
 * One logical unit of work run inside a transaction.
 */
@FunctionalInterface
public interface TransactionCallback<T> {

    T doInTransaction(ConnectionHandle handle) throws SQLException;
}
