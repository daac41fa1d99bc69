package com.wpanther.memorygateway.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registered client as persisted in clients.json. Records are never deleted;
 * revocation is one-way.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OAuth2Client {

    private String clientId;

    private String name;

    @Builder.Default
    private String description = "";

    private String secretHash;

    private Instant createdAt;

    private boolean revoked;

    private Instant revokedAt;
}
