package com.apistack.common.security;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;

/**
 * Mints HMAC-SHA256 signed tokens accepted by {@link JwtCredentialVerifier}.
 * Login flows live outside this stack; this is used by tooling and tests.
 */
@Slf4j
public class JwtTokenIssuer {

    private final SecretKey secretKey;
    private final String issuer;
    private final Clock clock;

    public JwtTokenIssuer(String secret, String issuer, Clock clock) {
        this.secretKey = JwtKeys.hmac(secret);
        this.issuer = issuer;
        this.clock = clock;
    }

    /**
     * Generate token valid for {@code ttl} from now
     */
    public String issue(String subject, Collection<String> roles, Duration ttl) {
        Instant now = clock.instant();
        return issue(subject, roles, now, now.plus(ttl));
    }

    /**
     * Generate token with explicit issue and expiry instants
     */
    public String issue(String subject, Collection<String> roles, Instant issuedAt, Instant expiresAt) {
        JwtBuilder builder = Jwts.builder()
                .subject(subject)
                .claim(JwtCredentialVerifier.ROLES_CLAIM, new ArrayList<>(roles))
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(secretKey, Jwts.SIG.HS256);
        if (issuer != null && !issuer.isBlank()) {
            builder.issuer(issuer);
        }

        String token = builder.compact();
        log.debug("Issued token for subject: {} with roles: {}", subject, roles);
        return token;
    }
}
