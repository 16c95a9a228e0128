package com.flagship.treasury_ledger.security;

import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * HMAC key for guardian bearer tokens.
 *
 * Startup fails when the configured secret is shorter than 32 bytes, the
 * minimum for HS256.
 */
@Configuration
public class JwtConfig {

    static final int MIN_SECRET_BYTES = 32;

    @Value("${treasury.security.jwt-secret}")
    private String secret;

    @Bean
    public SecretKey guardianSigningKey() {
        return signingKey(secret);
    }

    static SecretKey signingKey(String secret) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                "treasury.security.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }
}
