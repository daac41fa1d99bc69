package com.wpanther.memorygateway.security;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Verified access token payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenClaims {

    /**
     * Client id the token was issued to.
     */
    private String subject;

    private String name;

    private String type;

    private String scope;

    private Instant issuedAt;

    private Instant expiresAt;
}
