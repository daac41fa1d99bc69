package com.wpanther.memorygateway.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Authorization code issued by the consent step.
 *
 * Codes are:
 * - Short-lived (default: 10 minutes)
 * - Single-use (marked as used after exchange, kept for replay auditing)
 * - Bound to client, redirect URI, and PKCE challenge
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AuthorizationCode {

    private String code;

    private String clientId;

    /**
     * Must match exactly during token exchange.
     */
    private String redirectUri;

    private String scope;

    private String codeChallenge;

    /**
     * S256 or plain.
     */
    private String codeChallengeMethod;

    private Instant createdAt;

    private Instant expiresAt;

    private boolean used;

    private Instant usedAt;

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
