package com.apistack.persistence;

import com.apistack.persistence.dialect.SqlDialect;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * One pooled connection inside one transaction.
 * Only valid inside the callback it was passed to; the gateway commits or rolls back and releases it afterwards.
 */
public interface ConnectionHandle {

    <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) throws SQLException;

    /**
     * @throws com.apistack.common.exception.DataException with kind NOT_FOUND when no row matches
     */
    <T> T queryOne(String sql, RowMapper<T> mapper, Object... params) throws SQLException;

    <T> Optional<T> queryOptional(String sql, RowMapper<T> mapper, Object... params) throws SQLException;

    int update(String sql, Object... params) throws SQLException;

    /**
     * @throws com.apistack.common.exception.DataException with kind NOT_FOUND when nothing was updated
     */
    void updateExactlyOne(String sql, Object... params) throws SQLException;

    /**
     * Fold and quote a logical identifier for the active engine.
     */
    String quote(String identifier);

    String paginate(String sql, long offset, int limit);

    SqlDialect dialect();
}
