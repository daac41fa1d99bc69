package com.wpanther.memorygateway.service;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.wpanther.memorygateway.config.OAuthProperties;
import com.wpanther.memorygateway.entity.OAuth2Client;
import com.wpanther.memorygateway.entity.RefreshToken;
import com.wpanther.memorygateway.exception.OAuth2Exception;
import com.wpanther.memorygateway.exception.StorageException;
import com.wpanther.memorygateway.repository.RefreshTokenRepository;
import com.wpanther.memorygateway.repository.SigningKeyRepository;
import com.wpanther.memorygateway.security.TokenClaims;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Mints and verifies HS256 access tokens and manages opaque refresh tokens.
 *
 * Access tokens are not stored; verification re-resolves the client every time so a
 * revocation applies to tokens that are still unexpired.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenService {

    public static final String ACCESS_TOKEN_TYPE = "access_token";
    static final String CLAIM_NAME = "name";
    static final String CLAIM_TYPE = "type";
    static final String CLAIM_SCOPE = "scope";

    private static final int REFRESH_TOKEN_BYTES = 48;

    private final SigningKeyRepository signingKeyRepository;
    private final RefreshTokenRepository refreshTokenRepository;
    private final ClientRegistrationService clientRegistrationService;
    private final OAuthProperties properties;
    private final SecureRandom secureRandom;
    private final Clock clock;

    public String issueAccessToken(String clientId) {
        return issueAccessToken(clientId, null);
    }

    /**
     * @throws OAuth2Exception invalid_client when the client does not exist
     */
    public String issueAccessToken(String clientId, String scope) {
        OAuth2Client client = clientRegistrationService.findActiveClient(clientId)
                .orElseThrow(() -> new OAuth2Exception(OAuth2Exception.INVALID_CLIENT, "Unknown or revoked client"));

        Instant issuedAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(properties.getAccessTokenTtl());

        JWTClaimsSet.Builder claims = new JWTClaimsSet.Builder()
                .subject(client.getClientId())
                .claim(CLAIM_NAME, client.getName())
                .claim(CLAIM_TYPE, ACCESS_TOKEN_TYPE)
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(expiresAt))
                .jwtID(UUID.randomUUID().toString());
        if (scope != null && !scope.isEmpty()) {
            claims.claim(CLAIM_SCOPE, scope);
        }

        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims.build());
        try {
            jwt.sign(new MACSigner(signingKeyRepository.getSecretKey()));
        } catch (JOSEException e) {
            throw new OAuth2Exception(OAuth2Exception.SERVER_ERROR, "Unable to sign access token", e);
        }
        log.debug("Access token issued for client {}", clientId);
        return jwt.serialize();
    }

    public long getAccessTokenExpiresIn() {
        return properties.getAccessTokenTtl().toSeconds();
    }

    /**
     * Verifies signature, type, expiry and the live client state. Never throws.
     */
    public Optional<TokenClaims> verify(String token) {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        try {
            SignedJWT jwt = SignedJWT.parse(token);
            if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
                return Optional.empty();
            }
            if (!jwt.verify(new MACVerifier(signingKeyRepository.getSecretKey()))) {
                log.debug("Access token with invalid signature");
                return Optional.empty();
            }

            JWTClaimsSet claims = jwt.getJWTClaimsSet();
            Date expiration = claims.getExpirationTime();
            if (expiration == null || !Instant.now(clock).isBefore(expiration.toInstant())) {
                log.debug("Expired access token for client {}", claims.getSubject());
                return Optional.empty();
            }
            if (!ACCESS_TOKEN_TYPE.equals(claims.getStringClaim(CLAIM_TYPE)) || claims.getSubject() == null) {
                return Optional.empty();
            }
            if (clientRegistrationService.findActiveClient(claims.getSubject()).isEmpty()) {
                log.debug("Access token for unknown or revoked client {}", claims.getSubject());
                return Optional.empty();
            }

            return Optional.of(TokenClaims.builder()
                    .subject(claims.getSubject())
                    .name(claims.getStringClaim(CLAIM_NAME))
                    .type(ACCESS_TOKEN_TYPE)
                    .scope(claims.getStringClaim(CLAIM_SCOPE))
                    .issuedAt(claims.getIssueTime() != null ? claims.getIssueTime().toInstant() : null)
                    .expiresAt(expiration.toInstant())
                    .build());
        } catch (ParseException | JOSEException e) {
            log.debug("Malformed access token: {}", e.getMessage());
            return Optional.empty();
        } catch (StorageException e) {
            log.error("Access token rejected because server state could not be read", e);
            return Optional.empty();
        }
    }

    /**
     * Starts a new refresh token family for a client.
     */
    public String issueRefreshToken(String clientId, String scope) {
        String token = generateRefreshToken();
        refreshTokenRepository.save(newRefreshToken(token, clientId, scope, UUID.randomUUID().toString()));
        return token;
    }

    /**
     * Exchanges a refresh token for its successor. The presented token is revoked; replaying
     * an already rotated token revokes its whole family.
     *
     * @param presentedClientId client id sent with the request, may be null
     * @throws OAuth2Exception invalid_grant when the token cannot be used
     */
    public RotatedRefreshToken rotateRefreshToken(String refreshToken, String presentedClientId) {
        if (refreshToken == null || refreshToken.isEmpty()) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_REQUEST, "refresh_token is required");
        }
        String tokenHash = hashToken(refreshToken);
        Instant now = Instant.now(clock);

        RotationOutcome outcome = refreshTokenRepository.update(tokens -> {
            RefreshToken current = tokens.get(tokenHash);
            if (current == null) {
                return RotationOutcome.rejected("Invalid refresh token");
            }
            if (current.isRevoked()) {
                if (current.getReplacedBy() != null) {
                    log.warn("Refresh token reuse detected for client {}, revoking token family",
                            current.getClientId());
                    revokeFamily(tokens, current.getTokenFamily(), now);
                }
                return RotationOutcome.rejected("Refresh token has been revoked");
            }
            if (!current.isValid(now)) {
                return RotationOutcome.rejected("Refresh token has expired");
            }
            if (presentedClientId != null && !presentedClientId.equals(current.getClientId())) {
                return RotationOutcome.rejected("Refresh token was not issued to this client");
            }
            if (clientRegistrationService.findActiveClient(current.getClientId()).isEmpty()) {
                return RotationOutcome.rejected("Client is unknown or revoked");
            }

            String successor = generateRefreshToken();
            RefreshToken next = newRefreshToken(successor, current.getClientId(), current.getScope(),
                    current.getTokenFamily());
            current.setRevoked(true);
            current.setRevokedAt(now);
            current.setReplacedBy(next.getTokenHash());
            tokens.put(next.getTokenHash(), next);
            return RotationOutcome.rotated(
                    new RotatedRefreshToken(current.getClientId(), current.getScope(), successor));
        });

        if (outcome.getRotated() == null) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_GRANT, outcome.getErrorDescription());
        }
        return outcome.getRotated();
    }

    private void revokeFamily(Map<String, RefreshToken> tokens, String family, Instant now) {
        tokens.values().stream()
                .filter(token -> family.equals(token.getTokenFamily()) && !token.isRevoked())
                .forEach(token -> {
                    token.setRevoked(true);
                    token.setRevokedAt(now);
                });
    }

    private RefreshToken newRefreshToken(String token, String clientId, String scope, String family) {
        Instant now = Instant.now(clock);
        return RefreshToken.builder()
                .tokenHash(hashToken(token))
                .clientId(clientId)
                .scope(scope)
                .tokenFamily(family)
                .createdAt(now)
                .expiresAt(now.plus(properties.getRefreshTokenTtl()))
                .revoked(false)
                .build();
    }

    private String generateRefreshToken() {
        byte[] tokenBytes = new byte[REFRESH_TOKEN_BYTES];
        secureRandom.nextBytes(tokenBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(tokenBytes);
    }

    static String hashToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Value
    public static class RotatedRefreshToken {
        String clientId;
        String scope;
        String refreshToken;
    }

    /**
     * Result of the locked rotation step. Rejections are raised only after the store write,
     * so a family revocation triggered by reuse is persisted.
     */
    @Value
    private static class RotationOutcome {
        RotatedRefreshToken rotated;
        String errorDescription;

        static RotationOutcome rotated(RotatedRefreshToken rotated) {
            return new RotationOutcome(rotated, null);
        }

        static RotationOutcome rejected(String errorDescription) {
            return new RotationOutcome(null, errorDescription);
        }
    }
}
