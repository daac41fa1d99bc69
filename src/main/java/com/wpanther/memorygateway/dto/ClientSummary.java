package com.wpanther.memorygateway.dto;

import com.wpanther.memorygateway.entity.OAuth2Client;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Client view without the secret hash.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientSummary {
    private String clientId;
    private String name;
    private String description;
    private Instant createdAt;
    private boolean revoked;
    private Instant revokedAt;

    public static ClientSummary from(OAuth2Client client) {
        return ClientSummary.builder()
                .clientId(client.getClientId())
                .name(client.getName())
                .description(client.getDescription() != null ? client.getDescription() : "")
                .createdAt(client.getCreatedAt())
                .revoked(client.isRevoked())
                .revokedAt(client.getRevokedAt())
                .build();
    }
}
