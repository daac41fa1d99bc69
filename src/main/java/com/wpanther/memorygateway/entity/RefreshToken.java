package com.wpanther.memorygateway.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Refresh token record. Only the SHA-256 hash of the token is stored.
 *
 * Each use rotates the token; every token issued from the same authorization
 * shares a family, and the family is revoked when a rotated token is replayed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RefreshToken {

    private String tokenHash;

    private String clientId;

    private String scope;

    private String tokenFamily;

    private Instant createdAt;

    private Instant expiresAt;

    private boolean revoked;

    private Instant revokedAt;

    /**
     * Hash of the token that replaced this one on rotation.
     */
    private String replacedBy;

    @JsonIgnore
    public boolean isValid(Instant now) {
        return !revoked && now.isBefore(expiresAt);
    }
}
