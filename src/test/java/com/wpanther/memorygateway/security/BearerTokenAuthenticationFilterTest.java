package com.wpanther.memorygateway.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.memorygateway.config.OAuthProperties;
import com.wpanther.memorygateway.service.ServerUrlResolver;
import com.wpanther.memorygateway.service.TokenService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BearerTokenAuthenticationFilterTest {

    @Mock
    private TokenService tokenService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private BearerTokenAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        OAuthProperties properties = new OAuthProperties();
        properties.setPathPrefix("/memory");
        filter = new BearerTokenAuthenticationFilter(tokenService, new ServerUrlResolver(properties), objectMapper);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void testMissingTokenIsChallenged() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/mcp/tools");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(chain.getRequest()).isNull();
        assertThat(response.getHeader("WWW-Authenticate")).isEqualTo(
                "Bearer error=\"invalid_request\", error_description=\"Missing bearer token\", "
                        + "resource_metadata=\"http://localhost/.well-known/oauth-protected-resource/memory/mcp\"");
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.get("error").asText()).isEqualTo("invalid_request");
        verifyNoInteractions(tokenService);
    }

    @Test
    void testInvalidTokenIsChallenged() throws Exception {
        when(tokenService.verify("bad")).thenReturn(Optional.empty());
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/oauth/info");
        request.addHeader("Authorization", "Bearer bad");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getHeader("WWW-Authenticate")).startsWith("Bearer error=\"invalid_token\"");
        assertThat(objectMapper.readTree(response.getContentAsString()).get("error_description").asText())
                .isEqualTo("Token is invalid or expired");
    }

    @Test
    void testValidTokenAuthenticatesRequest() throws Exception {
        TokenClaims claims = TokenClaims.builder()
                .subject("smc_client")
                .name("Claude")
                .type(TokenService.ACCESS_TOKEN_TYPE)
                .scope("memory read")
                .issuedAt(Instant.parse("2026-01-15T10:00:00Z"))
                .expiresAt(Instant.parse("2026-01-15T11:00:00Z"))
                .build();
        when(tokenService.verify("good")).thenReturn(Optional.of(claims));
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/oauth/info");
        request.addHeader("Authorization", "bearer good");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<Authentication> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) ->
                seen.set(SecurityContextHolder.getContext().getAuthentication()));

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(seen.get()).isInstanceOf(BearerTokenAuthentication.class);
        assertThat(seen.get().isAuthenticated()).isTrue();
        assertThat(seen.get().getName()).isEqualTo("smc_client");
        assertThat(seen.get().getPrincipal()).isSameAs(claims);
        assertThat(seen.get().getAuthorities()).extracting("authority")
                .containsExactly("SCOPE_memory", "SCOPE_read");
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    void testPreflightIsNotFiltered() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("OPTIONS", "/mcp");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(200);
        assertThat(chain.getRequest()).isSameAs(request);
    }
}
