package com.wpanther.memorygateway.service;

import com.wpanther.memorygateway.config.OAuthProperties;
import com.wpanther.memorygateway.entity.AuthorizationCode;
import com.wpanther.memorygateway.entity.OAuth2Client;
import com.wpanther.memorygateway.exception.OAuth2Exception;
import com.wpanther.memorygateway.repository.AuthorizationCodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;

/**
 * Issues and redeems single-use authorization codes bound to a PKCE challenge.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthorizationCodeService {

    private static final int CODE_BYTES = 32;

    private final AuthorizationCodeRepository codeRepository;
    private final ClientRegistrationService clientRegistrationService;
    private final RedirectUriPolicy redirectUriPolicy;
    private final PkceService pkceService;
    private final OAuthProperties properties;
    private final SecureRandom secureRandom;
    private final Clock clock;

    /**
     * Checks shared by the consent page, the consent decision and code issuance.
     * Every failure is a 400.
     *
     * @return the requesting client
     */
    public OAuth2Client validateAuthorizationRequest(String clientId, String redirectUri,
                                                     String codeChallenge, String codeChallengeMethod) {
        if (clientId == null || clientId.isEmpty()) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_REQUEST, "client_id is required");
        }
        OAuth2Client client = clientRegistrationService.findActiveClient(clientId)
                .orElseThrow(() -> {
                    log.warn("Authorization request for unknown or revoked client {}", clientId);
                    return new OAuth2Exception(OAuth2Exception.INVALID_CLIENT,
                            "Unknown or revoked client", HttpStatus.BAD_REQUEST);
                });

        if (redirectUri == null || redirectUri.isEmpty()) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_REQUEST, "redirect_uri is required");
        }
        if (!redirectUriPolicy.isAllowed(redirectUri)) {
            log.warn("Authorization request with disallowed redirect_uri {} for client {}", redirectUri, clientId);
            throw new OAuth2Exception(OAuth2Exception.INVALID_REQUEST, "redirect_uri is not allowed");
        }
        if (codeChallenge == null || codeChallenge.isEmpty()) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_REQUEST, "code_challenge is required");
        }
        if (!pkceService.isSupportedMethod(codeChallengeMethod)) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_REQUEST,
                    "code_challenge_method must be S256 or plain");
        }
        return client;
    }

    /**
     * Validates the request, then stores a new code expiring after the configured TTL.
     */
    public String issue(String clientId, String redirectUri, String codeChallenge,
                        String codeChallengeMethod, String scope) {
        validateAuthorizationRequest(clientId, redirectUri, codeChallenge, codeChallengeMethod);

        Instant now = Instant.now(clock);
        String code = generateCode();
        codeRepository.save(AuthorizationCode.builder()
                .code(code)
                .clientId(clientId)
                .redirectUri(redirectUri)
                .scope(scope)
                .codeChallenge(codeChallenge)
                .codeChallengeMethod(codeChallengeMethod)
                .createdAt(now)
                .expiresAt(now.plus(properties.getAuthorizationCodeTtl()))
                .used(false)
                .build());

        log.info("Authorization code issued for client {}", clientId);
        return code;
    }

    /**
     * Redeems a code exactly once. The record is marked used before returning and kept on file.
     *
     * @throws OAuth2Exception invalid_grant when the code is unknown, used, expired, bound to
     *                         another client or redirect_uri, or the verifier does not match
     */
    public RedeemedCode redeem(String code, String clientId, String redirectUri, String codeVerifier) {
        Instant now = Instant.now(clock);
        return codeRepository.update(codes -> {
            AuthorizationCode authCode = code != null ? codes.get(code) : null;
            if (authCode == null) {
                log.warn("Token request with unknown authorization code");
                throw invalidGrant("Invalid authorization code");
            }
            if (authCode.isUsed()) {
                log.warn("Replay of authorization code issued to client {}", authCode.getClientId());
                throw invalidGrant("Authorization code has already been used");
            }
            if (authCode.isExpired(now)) {
                throw invalidGrant("Authorization code has expired");
            }
            if (!authCode.getClientId().equals(clientId)) {
                log.warn("Authorization code for client {} presented by {}", authCode.getClientId(), clientId);
                throw invalidGrant("Client mismatch");
            }
            if (!authCode.getRedirectUri().equals(redirectUri)) {
                throw invalidGrant("redirect_uri mismatch");
            }
            if (!pkceService.verifyCodeChallenge(codeVerifier, authCode.getCodeChallenge(),
                    authCode.getCodeChallengeMethod())) {
                log.warn("PKCE verification failed for client {}", clientId);
                throw invalidGrant("Invalid code_verifier");
            }

            authCode.setUsed(true);
            authCode.setUsedAt(now);
            return new RedeemedCode(authCode.getClientId(), authCode.getScope());
        });
    }

    private static OAuth2Exception invalidGrant(String description) {
        return new OAuth2Exception(OAuth2Exception.INVALID_GRANT, description);
    }

    private String generateCode() {
        byte[] randomBytes = new byte[CODE_BYTES];
        secureRandom.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    @Value
    public static class RedeemedCode {
        String clientId;
        String scope;
    }
}
