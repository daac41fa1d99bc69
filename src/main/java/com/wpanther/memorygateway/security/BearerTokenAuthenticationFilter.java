package com.wpanther.memorygateway.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.memorygateway.exception.OAuth2Exception;
import com.wpanther.memorygateway.service.ServerUrlResolver;
import com.wpanther.memorygateway.service.TokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Requires a valid bearer access token on protected paths. Failures are answered here
 * with 401, an OAuth error body and a challenge pointing at the protected-resource
 * metadata.
 */
@Slf4j
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final ServerUrlResolver serverUrlResolver;
    private final ObjectMapper objectMapper;

    public BearerTokenAuthenticationFilter(TokenService tokenService, ServerUrlResolver serverUrlResolver,
                                           ObjectMapper objectMapper) {
        this.tokenService = tokenService;
        this.serverUrlResolver = serverUrlResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return HttpMethod.OPTIONS.matches(request.getMethod());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            log.debug("Missing bearer token for {}", request.getRequestURI());
            writeChallenge(request, response, OAuth2Exception.INVALID_REQUEST, "Missing bearer token");
            return;
        }

        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        Optional<TokenClaims> claims = tokenService.verify(token);
        if (claims.isEmpty()) {
            log.debug("Rejected bearer token for {}", request.getRequestURI());
            writeChallenge(request, response, OAuth2Exception.INVALID_TOKEN, "Token is invalid or expired");
            return;
        }

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(new BearerTokenAuthentication(claims.get(), token));
        SecurityContextHolder.setContext(context);
        try {
            filterChain.doFilter(request, response);
        } finally {
            SecurityContextHolder.clearContext();
        }
    }

    private void writeChallenge(HttpServletRequest request, HttpServletResponse response,
                                String error, String description) throws IOException {
        String challenge = String.format("Bearer error=\"%s\", error_description=\"%s\", resource_metadata=\"%s\"",
                error, description, serverUrlResolver.resourceMetadataUrl(request));

        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("error_description", description);

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, challenge);
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
