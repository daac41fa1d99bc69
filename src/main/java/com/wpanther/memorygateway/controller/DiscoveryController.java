package com.wpanther.memorygateway.controller;

import com.wpanther.memorygateway.dto.AuthorizationServerMetadata;
import com.wpanther.memorygateway.dto.ProtectedResourceMetadata;
import com.wpanther.memorygateway.service.OAuth2GrantService;
import com.wpanther.memorygateway.service.PkceService;
import com.wpanther.memorygateway.service.ServerUrlResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * RFC 8414, OpenID and RFC 9728 discovery documents. Each accepts an optional path
 * suffix; all URLs derive from the request origin plus the configured path prefix.
 */
@RestController
@RequiredArgsConstructor
public class DiscoveryController {

    static final String AUTHORIZATION_SERVER_PATH = "/.well-known/oauth-authorization-server";
    static final String OPENID_CONFIGURATION_PATH = "/.well-known/openid-configuration";

    private final ServerUrlResolver serverUrlResolver;

    @GetMapping(AUTHORIZATION_SERVER_PATH + "/**")
    public ResponseEntity<AuthorizationServerMetadata> authorizationServerMetadata(HttpServletRequest request) {
        return ResponseEntity.ok(metadata(request).build());
    }

    @GetMapping(OPENID_CONFIGURATION_PATH + "/**")
    public ResponseEntity<AuthorizationServerMetadata> openidConfiguration(HttpServletRequest request) {
        return ResponseEntity.ok(metadata(request)
                .subjectTypesSupported(List.of("public"))
                .build());
    }

    @GetMapping(ServerUrlResolver.PROTECTED_RESOURCE_METADATA_PATH + "/**")
    public ResponseEntity<ProtectedResourceMetadata> protectedResourceMetadata(HttpServletRequest request) {
        String suffix = pathSuffix(request, ServerUrlResolver.PROTECTED_RESOURCE_METADATA_PATH);
        return ResponseEntity.ok(ProtectedResourceMetadata.builder()
                .resource(serverUrlResolver.resource(request, suffix))
                .authorizationServers(List.of(serverUrlResolver.issuer(request)))
                .bearerMethodsSupported(List.of("header"))
                .build());
    }

    private AuthorizationServerMetadata.AuthorizationServerMetadataBuilder metadata(HttpServletRequest request) {
        String issuer = serverUrlResolver.issuer(request);
        return AuthorizationServerMetadata.builder()
                .issuer(issuer)
                .authorizationEndpoint(issuer + "/oauth/authorize")
                .tokenEndpoint(issuer + "/oauth/token")
                .tokenEndpointAuthMethodsSupported(List.of("client_secret_basic", "client_secret_post", "none"))
                .grantTypesSupported(List.of(OAuth2GrantService.GRANT_CLIENT_CREDENTIALS,
                        OAuth2GrantService.GRANT_AUTHORIZATION_CODE, OAuth2GrantService.GRANT_REFRESH_TOKEN))
                .responseTypesSupported(List.of("code"))
                .codeChallengeMethodsSupported(List.of(PkceService.METHOD_S256));
    }

    private static String pathSuffix(HttpServletRequest request, String base) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.length() > base.length() ? path.substring(base.length()) : "";
    }
}
