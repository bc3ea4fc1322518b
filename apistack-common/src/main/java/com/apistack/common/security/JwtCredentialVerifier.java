package com.apistack.common.security;

import com.apistack.common.exception.AuthException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.SecurityException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * JWT verifier for HMAC-SHA256 signed bearer tokens.
 * Checks signature, expiry (with clock-skew tolerance) and optionally the issuer.
 */
@Slf4j
public class JwtCredentialVerifier implements CredentialVerifier {

    static final String ROLES_CLAIM = "roles";
    static final String SCOPE_CLAIM = "scope";

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final JwtParser parser;
    private final Duration clockSkew;
    private final Clock clock;

    public JwtCredentialVerifier(String secret, String issuer, Duration clockSkew, Clock clock) {
        this.clockSkew = clockSkew == null ? Duration.ZERO : clockSkew;
        this.clock = clock;

        JwtParserBuilder builder = Jwts.parser()
                .verifyWith(JwtKeys.hmac(secret))
                .clockSkewSeconds(this.clockSkew.getSeconds())
                .clock(() -> Date.from(clock.instant()));
        if (issuer != null && !issuer.isBlank()) {
            builder.requireIssuer(issuer);
        }
        this.parser = builder.build();

        log.info("JwtCredentialVerifier initialized with clock skew: {}s, issuer check: {}",
                this.clockSkew.getSeconds(), issuer != null && !issuer.isBlank());
    }

    @Override
    public Principal verify(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthException(AuthException.Kind.MISSING, "Token is empty or null");
        }

        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            return toPrincipal(claims);

        } catch (ExpiredJwtException e) {
            log.debug("JWT token expired: {}", e.getMessage());
            throw new AuthException(AuthException.Kind.EXPIRED, "Token expired", e);
        } catch (SecurityException e) {
            // exp is read unverified here only to pick the reported kind; the token is rejected either way
            if (expiredWithoutVerification(token)) {
                log.debug("JWT token expired (signature not trusted either)");
                throw new AuthException(AuthException.Kind.EXPIRED, "Token expired", e);
            }
            log.debug("JWT signature validation failed: {}", e.getMessage());
            throw new AuthException(AuthException.Kind.INVALID_SIGNATURE, "Invalid token signature", e);
        } catch (ClaimJwtException e) {
            log.debug("JWT claim validation failed: {}", e.getMessage());
            throw new AuthException(AuthException.Kind.INVALID_SIGNATURE, "Token claims rejected", e);
        } catch (UnsupportedJwtException | MalformedJwtException e) {
            log.debug("Malformed JWT token: {}", e.getMessage());
            throw new AuthException(AuthException.Kind.MALFORMED, "Malformed token", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("JWT token could not be decoded: {}", e.getMessage());
            throw new AuthException(AuthException.Kind.MALFORMED, "Malformed token", e);
        }
    }

    private Principal toPrincipal(Claims claims) {
        String subject = claims.getSubject();
        Date expiration = claims.getExpiration();
        if (subject == null || subject.isBlank() || expiration == null) {
            throw new AuthException(AuthException.Kind.MALFORMED, "Token lacks subject or expiry");
        }

        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null;
        // effective expiry: the claim plus the tolerated skew
        Instant expiresAt = expiration.toInstant().plus(clockSkew);
        if (!clock.instant().isBefore(expiresAt)) {
            throw new AuthException(AuthException.Kind.EXPIRED, "Token expired");
        }

        return Principal.builder()
                .subject(subject)
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .roles(extractRoles(claims))
                .build();
    }

    private Set<String> extractRoles(Claims claims) {
        Set<String> roles = new LinkedHashSet<>();
        Object rolesClaim = claims.get(ROLES_CLAIM);
        if (rolesClaim instanceof Collection<?>) {
            for (Object role : (Collection<?>) rolesClaim) {
                if (role != null) {
                    roles.add(role.toString());
                }
            }
        }
        Object scopeClaim = claims.get(SCOPE_CLAIM);
        if (scopeClaim instanceof String) {
            for (String scope : ((String) scopeClaim).trim().split("\\s+")) {
                if (!scope.isEmpty()) {
                    roles.add(scope);
                }
            }
        }
        return roles;
    }

    private boolean expiredWithoutVerification(String token) {
        String[] parts = token.split("\\.");
        if (parts.length < 2) {
            return false;
        }
        try {
            JsonNode payload = objectMapper.readTree(Base64.getUrlDecoder().decode(parts[1]));
            JsonNode exp = payload.get("exp");
            if (exp == null || !exp.isNumber()) {
                return false;
            }
            Instant expiresAt = Instant.ofEpochSecond(exp.asLong()).plus(clockSkew);
            return !clock.instant().isBefore(expiresAt);
        } catch (IOException | IllegalArgumentException e) {
            return false;
        }
    }
}
