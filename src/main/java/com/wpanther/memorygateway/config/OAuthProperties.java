package com.wpanther.memorygateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Authorization server settings, bound once at startup from {@code app.oauth.*}.
 */
@Data
@ConfigurationProperties(prefix = "app.oauth")
public class OAuthProperties {

    /**
     * Directory holding clients.json, authorization_codes.json, refresh_tokens.json
     * and secret_key.txt. Created with owner-only permissions.
     */
    private Path storageDir = Path.of(System.getProperty("user.home"), ".memory-gateway", "oauth");

    /**
     * Development switch: accept any redirect_uri.
     */
    private boolean allowAnyRedirectUri = false;

    /**
     * Exact-match redirect_uri allowlist. When non-empty it replaces the built-in
     * connector callbacks.
     */
    private List<String> allowedRedirectUris = new ArrayList<>();

    /**
     * Prefix the server is mounted under behind a proxy, e.g. "/memory".
     */
    private String pathPrefix = "";

    /**
     * Path of the protected resource advertised in protected-resource metadata.
     */
    private String resourcePath = "/mcp";

    /**
     * Request paths that require a bearer token.
     */
    private List<String> protectedPaths = new ArrayList<>(List.of("/oauth/info", "/mcp/**"));

    private Duration accessTokenTtl = Duration.ofHours(1);

    private Duration refreshTokenTtl = Duration.ofDays(30);

    private Duration authorizationCodeTtl = Duration.ofMinutes(10);

    private String serviceName = "memory-gateway-oauth";

    private Hashing hashing = new Hashing();

    @Data
    public static class Hashing {

        /**
         * Scheme used for new hashes: bcrypt or pbkdf2.
         */
        private String preferredScheme = "bcrypt";

        private int bcryptStrength = 12;
    }
}
