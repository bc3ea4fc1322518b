package com.apistack.service.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A stored handler response. Serialized to JSON for the shared store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedResponse {
    private int status;
    private String contentType;
    private byte[] body;
    private Instant storedAt;
}
