package com.wpanther.memorygateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * RFC 8414 authorization server metadata. The OpenID discovery document reuses it
 * with {@code subjectTypesSupported} filled in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthorizationServerMetadata {

    private String issuer;

    private String authorizationEndpoint;

    private String tokenEndpoint;

    private List<String> tokenEndpointAuthMethodsSupported;

    private List<String> grantTypesSupported;

    private List<String> responseTypesSupported;

    private List<String> codeChallengeMethodsSupported;

    private List<String> subjectTypesSupported;
}
