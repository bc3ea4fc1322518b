package com.apistack.common.security;

import com.apistack.common.exception.AuthException;

/**
 * Parses {@code Authorization: Bearer <token>} header values.
 */
public final class BearerTokens {

    public static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    private BearerTokens() {
    }

    /**
     * @return the raw token
     * @throws AuthException MISSING when the header is absent, MALFORMED for any other scheme
     */
    public static String extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new AuthException(AuthException.Kind.MISSING, "Missing Authorization header");
        }
        String header = authorizationHeader.trim();
        if (header.length() <= BEARER_PREFIX.length()
                || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new AuthException(AuthException.Kind.MALFORMED, "Authorization header is not a bearer token");
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new AuthException(AuthException.Kind.MISSING, "Bearer token is empty");
        }
        return token;
    }
}
