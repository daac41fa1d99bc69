package com.wpanther.memorygateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClientRegistrationResponse {
    private String clientId;
    private String clientSecret;
    private String name;
    private String description;
    private Instant createdAt;
}
