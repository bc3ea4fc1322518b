package com.apistack.service.storage;

import lombok.Value;

import java.time.Instant;

/**
 * Time-limited capability to read or write one object without credentials.
 */
@Value
public class SignedUrl {

    String url;
    AccessMode mode;
    Instant issuedAt;
    Instant expiresAt;

    /**
     * Valid from issue time up to, but not including, the expiry instant.
     */
    public boolean isValidAt(Instant now) {
        return !now.isBefore(issuedAt) && now.isBefore(expiresAt);
    }
}
