package com.apistack.service.config;

import com.apistack.common.security.CredentialVerifier;
import com.apistack.common.security.JwtCredentialVerifier;
import com.apistack.common.security.JwtTokenIssuer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Token verification and issuance, sharing one HMAC secret.
 */
@Slf4j
@Configuration
public class JwtSecurityConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CredentialVerifier credentialVerifier(ApiStackProperties properties, Clock clock) {
        ApiStackProperties.JwtConfig jwt = properties.getSecurity().getJwt();
        log.info("JWT verification configured: issuer={}, clockSkew={}s",
                jwt.getIssuer(), jwt.getClockSkew().toSeconds());
        return new JwtCredentialVerifier(jwt.getSecret(), jwt.getIssuer(), jwt.getClockSkew(), clock);
    }

    @Bean
    public JwtTokenIssuer jwtTokenIssuer(ApiStackProperties properties, Clock clock) {
        ApiStackProperties.JwtConfig jwt = properties.getSecurity().getJwt();
        return new JwtTokenIssuer(jwt.getSecret(), jwt.getIssuer(), clock);
    }
}
