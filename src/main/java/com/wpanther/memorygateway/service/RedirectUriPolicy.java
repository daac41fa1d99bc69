package com.wpanther.memorygateway.service;

import com.wpanther.memorygateway.config.OAuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which redirect_uri values may receive codes. Exact string match only.
 *
 * Precedence: allow-any switch, then the configured allowlist, then the built-in
 * connector callbacks.
 */
@Component
@Slf4j
public class RedirectUriPolicy {

    public static final List<String> DEFAULT_REDIRECT_URIS = List.of(
            "https://chatgpt.com/connector_platform_oauth_redirect",
            "https://chat.openai.com/connector_platform_oauth_redirect",
            "https://claude.ai/api/mcp/auth_callback",
            "https://claude.com/api/mcp/auth_callback");

    private final boolean allowAny;
    private final Set<String> allowedRedirectUris;

    public RedirectUriPolicy(OAuthProperties properties) {
        this.allowAny = properties.isAllowAnyRedirectUri();
        Set<String> configured = new LinkedHashSet<>();
        for (String uri : properties.getAllowedRedirectUris()) {
            if (uri != null && !uri.isBlank()) {
                configured.add(uri.trim());
            }
        }
        this.allowedRedirectUris = configured.isEmpty()
                ? Set.copyOf(DEFAULT_REDIRECT_URIS)
                : Set.copyOf(configured);

        if (allowAny) {
            log.warn("Any redirect_uri is accepted; do not use this outside development");
        } else {
            log.info("Accepting {} redirect URI(s){}", allowedRedirectUris.size(),
                    configured.isEmpty() ? " (built-in defaults)" : "");
        }
    }

    public boolean isAllowed(String redirectUri) {
        if (redirectUri == null || redirectUri.isEmpty()) {
            return false;
        }
        return allowAny || allowedRedirectUris.contains(redirectUri);
    }
}
