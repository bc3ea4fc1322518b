package com.apistack.common.security;

import com.apistack.common.exception.AuthException;

/**
 * Turns an opaque bearer token into a {@link Principal}.
 * Implementations are stateless: the result depends only on the token,
 * the current time and the configured key.
 */
public interface CredentialVerifier {

    /**
     * @throws AuthException with kind MISSING, MALFORMED, EXPIRED or INVALID_SIGNATURE
     */
    Principal verify(String token);
}
