package com.apistack.service.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata of an object in a bucket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredObject {
    private String bucket;
    private String key;
    private long size;
    private String etag;
    private String contentType;
}
