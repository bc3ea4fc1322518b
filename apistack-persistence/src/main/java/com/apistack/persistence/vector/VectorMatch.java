package com.apistack.persistence.vector;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A row id together with its distance from the query embedding.
 */
@Data
@AllArgsConstructor
public class VectorMatch {
    private String id;
    private double distance;
}
