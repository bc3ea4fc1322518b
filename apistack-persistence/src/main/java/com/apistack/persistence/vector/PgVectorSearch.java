package com.apistack.persistence.vector;

import com.apistack.persistence.DataAccessGateway;
import com.apistack.persistence.dialect.SqlDialect;

import java.util.List;

/**
 * pgvector implementation using the L2 distance operator {@code <->}.
 */
public class PgVectorSearch implements VectorSearch {

    private final DataAccessGateway gateway;
    private final SqlDialect dialect;

    /**
     * @param dialect the gateway's own dialect, so identifiers fold and quote exactly as in its other statements
     */
    public PgVectorSearch(DataAccessGateway gateway, SqlDialect dialect) {
        this.gateway = gateway;
        this.dialect = dialect;
    }

    @Override
    public List<VectorMatch> nearest(VectorQuery query) {
        validate(query);
        String sql = buildSql(query);
        String vector = toVectorLiteral(query.getEmbedding());
        return gateway.withTransaction(handle -> handle.query(sql,
                rs -> new VectorMatch(rs.getString(1), rs.getDouble(2)),
                vector, vector, query.getLimit()));
    }

    String buildSql(VectorQuery query) {
        String id = quote(query.getIdColumn());
        String column = quote(query.getEmbeddingColumn());
        String table = quote(query.getTable());
        return "SELECT " + id + ", " + column + " <-> CAST(? AS vector) AS distance"
                + " FROM " + table
                + " ORDER BY " + column + " <-> CAST(? AS vector)"
                + " LIMIT ?";
    }

    static String toVectorLiteral(float[] embedding) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(embedding[i]);
        }
        return sb.append(']').toString();
    }

    private String quote(String identifier) {
        return dialect.quoteIdentifier(dialect.foldCase(identifier));
    }

    private static void validate(VectorQuery query) {
        if (query.getEmbedding() == null || query.getEmbedding().length == 0) {
            throw new IllegalArgumentException("Embedding must not be empty");
        }
        if (query.getLimit() <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + query.getLimit());
        }
    }
}
