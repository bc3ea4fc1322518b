package com.apistack.persistence.vector;

import java.util.List;

/**
 * Similarity search over embedding columns. Only offered by engines with a vector extension.
 */
public interface VectorSearch {

    /**
     * @return matches ordered by ascending distance, at most {@code query.getLimit()} of them
     */
    List<VectorMatch> nearest(VectorQuery query);
}
