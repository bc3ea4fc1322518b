package com.apistack.persistence.vector;

import lombok.Builder;
import lombok.Data;

/**
 * Nearest-neighbour lookup against an embedding column.
 */
@Data
@Builder
public class VectorQuery {
    private String table;
    @Builder.Default
    private String idColumn = "id";
    @Builder.Default
    private String embeddingColumn = "embedding";
    private float[] embedding;
    @Builder.Default
    private int limit = 10;
}
