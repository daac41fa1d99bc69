package com.wpanther.memorygateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token endpoint parameters, merged from the form or JSON body and the Basic
 * authorization header.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenRequest {

    private String grantType;

    private String clientId;

    private String clientSecret;

    private String code;

    private String redirectUri;

    private String codeVerifier;

    private String refreshToken;

    private String scope;
}
