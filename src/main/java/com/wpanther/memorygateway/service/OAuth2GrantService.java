package com.wpanther.memorygateway.service;

import com.wpanther.memorygateway.dto.OAuth2TokenResponse;
import com.wpanther.memorygateway.dto.TokenRequest;
import com.wpanther.memorygateway.exception.OAuth2Exception;
import com.wpanther.memorygateway.service.AuthorizationCodeService.RedeemedCode;
import com.wpanther.memorygateway.service.TokenService.RotatedRefreshToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Token endpoint grant dispatch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OAuth2GrantService {

    public static final String GRANT_CLIENT_CREDENTIALS = "client_credentials";
    public static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
    public static final String GRANT_REFRESH_TOKEN = "refresh_token";

    private final ClientRegistrationService clientRegistrationService;
    private final AuthorizationCodeService authorizationCodeService;
    private final TokenService tokenService;

    public OAuth2TokenResponse grant(TokenRequest request) {
        String grantType = request.getGrantType();
        if (isBlank(grantType)) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_REQUEST, "grant_type is required");
        }
        log.debug("Token request with grant type {} for client {}", grantType, request.getClientId());

        switch (grantType) {
            case GRANT_CLIENT_CREDENTIALS:
                return clientCredentialsGrant(request);
            case GRANT_AUTHORIZATION_CODE:
                return authorizationCodeGrant(request);
            case GRANT_REFRESH_TOKEN:
                return refreshTokenGrant(request);
            default:
                throw new OAuth2Exception(OAuth2Exception.UNSUPPORTED_GRANT_TYPE,
                        "Unsupported grant type: " + grantType);
        }
    }

    /**
     * Access token only, no refresh token for this grant.
     */
    public OAuth2TokenResponse clientCredentialsGrant(TokenRequest request) {
        if (isBlank(request.getClientId()) || isBlank(request.getClientSecret())) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_CLIENT, "Client authentication is required");
        }
        if (!clientRegistrationService.verifyClient(request.getClientId(), request.getClientSecret())) {
            log.warn("Client credentials grant rejected for client {}", request.getClientId());
            throw new OAuth2Exception(OAuth2Exception.INVALID_CLIENT, "Invalid client credentials");
        }

        String accessToken = tokenService.issueAccessToken(request.getClientId(), request.getScope());
        log.info("Issued client credentials token for client {}", request.getClientId());
        return OAuth2TokenResponse.builder()
                .accessToken(accessToken)
                .tokenType(OAuth2TokenResponse.TOKEN_TYPE_BEARER)
                .expiresIn(tokenService.getAccessTokenExpiresIn())
                .scope(request.getScope())
                .build();
    }

    public OAuth2TokenResponse authorizationCodeGrant(TokenRequest request) {
        requireParameter(request.getClientId(), "client_id");
        requireParameter(request.getCode(), "code");
        requireParameter(request.getRedirectUri(), "redirect_uri");
        requireParameter(request.getCodeVerifier(), "code_verifier");

        authenticateClient(request);

        RedeemedCode redeemed = authorizationCodeService.redeem(request.getCode(), request.getClientId(),
                request.getRedirectUri(), request.getCodeVerifier());
        String scope = !isBlank(redeemed.getScope()) ? redeemed.getScope() : request.getScope();

        String accessToken = tokenService.issueAccessToken(redeemed.getClientId(), scope);
        String refreshToken = tokenService.issueRefreshToken(redeemed.getClientId(), scope);
        log.info("Exchanged authorization code for client {}", redeemed.getClientId());
        return OAuth2TokenResponse.builder()
                .accessToken(accessToken)
                .tokenType(OAuth2TokenResponse.TOKEN_TYPE_BEARER)
                .expiresIn(tokenService.getAccessTokenExpiresIn())
                .scope(scope)
                .refreshToken(refreshToken)
                .build();
    }

    public OAuth2TokenResponse refreshTokenGrant(TokenRequest request) {
        requireParameter(request.getRefreshToken(), "refresh_token");
        if (!isBlank(request.getClientSecret())) {
            authenticateClient(request);
        }

        RotatedRefreshToken rotated = tokenService.rotateRefreshToken(request.getRefreshToken(),
                request.getClientId());
        String accessToken = tokenService.issueAccessToken(rotated.getClientId(), rotated.getScope());
        log.info("Refreshed access token for client {}", rotated.getClientId());
        return OAuth2TokenResponse.builder()
                .accessToken(accessToken)
                .tokenType(OAuth2TokenResponse.TOKEN_TYPE_BEARER)
                .expiresIn(tokenService.getAccessTokenExpiresIn())
                .scope(rotated.getScope())
                .refreshToken(rotated.getRefreshToken())
                .build();
    }

    /**
     * Confidential clients must present a valid secret; public clients only need to be active.
     */
    private void authenticateClient(TokenRequest request) {
        String clientId = request.getClientId();
        if (!isBlank(request.getClientSecret())) {
            if (isBlank(clientId) || !clientRegistrationService.verifyClient(clientId, request.getClientSecret())) {
                log.warn("Client authentication failed for client {}", clientId);
                throw new OAuth2Exception(OAuth2Exception.INVALID_CLIENT, "Invalid client credentials");
            }
            return;
        }
        if (clientRegistrationService.findActiveClient(clientId).isEmpty()) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_CLIENT, "Unknown or revoked client");
        }
    }

    private static void requireParameter(String value, String name) {
        if (isBlank(value)) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_REQUEST, name + " is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
