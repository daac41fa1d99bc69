package com.wpanther.memorygateway.controller;

import com.wpanther.memorygateway.dto.OAuth2TokenResponse;
import com.wpanther.memorygateway.dto.TokenInfoResponse;
import com.wpanther.memorygateway.dto.TokenRequest;
import com.wpanther.memorygateway.exception.OAuth2Exception;
import com.wpanther.memorygateway.security.TokenClaims;
import com.wpanther.memorygateway.service.OAuth2GrantService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.function.Function;

/**
 * Token endpoint and token introspection for the bearer of an access token.
 */
@RestController
@RequestMapping("/oauth")
@RequiredArgsConstructor
@Slf4j
public class TokenController {

    private static final String BASIC_PREFIX = "Basic ";

    private final OAuth2GrantService grantService;

    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<OAuth2TokenResponse> tokenForm(
            @RequestParam MultiValueMap<String, String> parameters,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return token(toTokenRequest(parameters::getFirst), authorization);
    }

    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<OAuth2TokenResponse> tokenJson(
            @RequestBody Map<String, Object> body,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return token(toTokenRequest(name -> {
            Object value = body.get(name);
            return value != null ? value.toString() : null;
        }), authorization);
    }

    /**
     * Claims of the presented access token. Reached only through the bearer filter.
     */
    @GetMapping("/info")
    public ResponseEntity<TokenInfoResponse> info(@AuthenticationPrincipal TokenClaims claims) {
        if (claims == null) {
            throw new OAuth2Exception(OAuth2Exception.INVALID_TOKEN, "Token is invalid or expired");
        }
        return ResponseEntity.ok(TokenInfoResponse.builder()
                .clientId(claims.getSubject())
                .clientName(claims.getName())
                .expiresAt(claims.getExpiresAt() != null ? claims.getExpiresAt().getEpochSecond() : null)
                .issuedAt(claims.getIssuedAt() != null ? claims.getIssuedAt().getEpochSecond() : null)
                .build());
    }

    private ResponseEntity<OAuth2TokenResponse> token(TokenRequest request, String authorization) {
        applyBasicCredentials(request, authorization);
        OAuth2TokenResponse response = grantService.grant(request);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .header(HttpHeaders.PRAGMA, "no-cache")
                .body(response);
    }

    private static TokenRequest toTokenRequest(Function<String, String> parameter) {
        return TokenRequest.builder()
                .grantType(parameter.apply("grant_type"))
                .clientId(parameter.apply("client_id"))
                .clientSecret(parameter.apply("client_secret"))
                .code(parameter.apply("code"))
                .redirectUri(parameter.apply("redirect_uri"))
                .codeVerifier(parameter.apply("code_verifier"))
                .refreshToken(parameter.apply("refresh_token"))
                .scope(parameter.apply("scope"))
                .build();
    }

    /**
     * HTTP Basic credentials take precedence over body parameters (RFC 6749 section 2.3.1).
     */
    static void applyBasicCredentials(TokenRequest request, String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return;
        }
        try {
            String decoded = new String(Base64.getDecoder().decode(authorization.substring(BASIC_PREFIX.length()).trim()),
                    StandardCharsets.UTF_8);
            int separator = decoded.indexOf(':');
            if (separator < 0) {
                throw new OAuth2Exception(OAuth2Exception.INVALID_CLIENT, "Malformed Basic credentials");
            }
            request.setClientId(URLDecoder.decode(decoded.substring(0, separator), StandardCharsets.UTF_8));
            request.setClientSecret(URLDecoder.decode(decoded.substring(separator + 1), StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            log.debug("Undecodable Basic credentials: {}", e.getMessage());
            throw new OAuth2Exception(OAuth2Exception.INVALID_CLIENT, "Malformed Basic credentials");
        }
    }
}
