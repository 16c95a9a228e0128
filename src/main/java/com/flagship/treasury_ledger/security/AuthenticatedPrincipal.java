package com.flagship.treasury_ledger.security;

import lombok.Value;

import java.time.Instant;

/**
 * Caller identity taken from a verified bearer token.
 */
@Value
public class AuthenticatedPrincipal {
    String subject;
    String role;
    Instant expiresAt;
}
