package com.wpanther.memorygateway.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenInfoResponse {

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("client_name")
    private String clientName;

    /**
     * Epoch seconds.
     */
    @JsonProperty("expires_at")
    private Long expiresAt;

    @JsonProperty("issued_at")
    private Long issuedAt;
}
