package com.wpanther.memorygateway.service;

import com.wpanther.memorygateway.config.OAuthProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Derives public URLs from the incoming request and the configured path prefix, so the
 * server can be mounted under a sub-path behind a proxy.
 */
@Component
public class ServerUrlResolver {

    public static final String PROTECTED_RESOURCE_METADATA_PATH = "/.well-known/oauth-protected-resource";

    private final String pathPrefix;
    private final String resourcePath;

    public ServerUrlResolver(OAuthProperties properties) {
        this.pathPrefix = normalizePath(properties.getPathPrefix());
        this.resourcePath = normalizePath(properties.getResourcePath());
    }

    /**
     * Scheme, host, port and context path of the request, without trailing slash.
     */
    public String baseUrl(HttpServletRequest request) {
        return stripTrailingSlash(ServletUriComponentsBuilder.fromContextPath(request).build().toUriString());
    }

    public String issuer(HttpServletRequest request) {
        return baseUrl(request) + pathPrefix;
    }

    /**
     * Resource identifier: the explicit suffix of a path-qualified metadata request, or the
     * configured resource path.
     */
    public String resource(HttpServletRequest request, String pathSuffix) {
        String suffix = normalizePath(pathSuffix);
        return baseUrl(request) + (suffix.isEmpty() ? pathPrefix + resourcePath : suffix);
    }

    public String resourceMetadataUrl(HttpServletRequest request) {
        return baseUrl(request) + PROTECTED_RESOURCE_METADATA_PATH + pathPrefix + resourcePath;
    }

    static String normalizePath(String path) {
        if (path == null || path.isBlank() || "/".equals(path.trim())) {
            return "";
        }
        String normalized = stripTrailingSlash(path.trim());
        return normalized.startsWith("/") ? normalized : "/" + normalized;
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
