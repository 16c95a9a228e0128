package com.flagship.treasury_ledger.security;

import com.flagship.treasury_ledger.exception.InsufficientRoleException;
import com.flagship.treasury_ledger.exception.InvalidTokenException;
import com.flagship.treasury_ledger.exception.TokenExpiredException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Checks signed bearer tokens before privileged mutations.
 *
 * Tokens are HS256 JWTs carrying {@code sub}, {@code role} and
 * {@code exp}. All checks happen before any state is touched.
 */
@Component
@Slf4j
public class AccessGate {

    static final String ROLE_CLAIM = "role";

    private final SecretKey signingKey;
    private final String tokenPrefix;

    public AccessGate(SecretKey guardianSigningKey,
                      @Value("${treasury.security.token-prefix:Bearer }") String tokenPrefix) {
        this.signingKey = guardianSigningKey;
        this.tokenPrefix = tokenPrefix;
    }

    /**
     * @throws InvalidTokenException if the token is missing, malformed,
     *         badly signed or lacks a required claim
     * @throws TokenExpiredException if {@code exp} has passed
     * @throws InsufficientRoleException if the role claim differs from
     *         {@code requiredRole}
     */
    public AuthenticatedPrincipal authorize(String token, String requiredRole) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Bearer token is missing");
        }

        Claims claims;
        String role;
        try {
            claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            role = claims.get(ROLE_CLAIM, String.class);
        } catch (ExpiredJwtException e) {
            throw new TokenExpiredException();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw new InvalidTokenException("Bearer token is invalid");
        }

        String subject = claims.getSubject();
        Date expiration = claims.getExpiration();
        if (subject == null || subject.isBlank() || role == null || expiration == null) {
            throw new InvalidTokenException("Bearer token lacks sub, role or exp claim");
        }
        if (!requiredRole.equals(role)) {
            throw new InsufficientRoleException(subject, role, requiredRole);
        }
        return new AuthenticatedPrincipal(subject, role, expiration.toInstant());
    }

    /**
     * Authorizes an {@code Authorization} header value as a guardian.
     */
    public AuthenticatedPrincipal requireGuardian(String authorizationHeader) {
        return authorize(stripPrefix(authorizationHeader), Roles.GUARDIAN);
    }

    public String issueToken(String subject, String role, Duration ttl) {
        Instant now = Instant.now();
        return Jwts.builder()
                .subject(subject)
                .claim(ROLE_CLAIM, role)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
    }

    private String stripPrefix(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        if (!header.startsWith(tokenPrefix)) {
            throw new InvalidTokenException("Authorization header must use the " + tokenPrefix.trim() + " scheme");
        }
        return header.substring(tokenPrefix.length()).trim();
    }
}
