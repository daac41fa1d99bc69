package com.wpanther.memorygateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.memorygateway.security.BearerTokenAuthenticationFilter;
import com.wpanther.memorygateway.service.ServerUrlResolver;
import com.wpanther.memorygateway.service.TokenService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
public class SecurityConfig {

    /**
     * Protected paths: bearer token required.
     */
    @Bean
    @Order(1)
    public SecurityFilterChain protectedResourceSecurityFilterChain(HttpSecurity http, OAuthProperties properties,
                                                                    TokenService tokenService,
                                                                    ServerUrlResolver serverUrlResolver,
                                                                    ObjectMapper objectMapper) throws Exception {
        http
                .securityMatcher(properties.getProtectedPaths().toArray(new String[0]))
                .authorizeHttpRequests(authorize -> authorize
                        .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                        .anyRequest().authenticated())
                .addFilterBefore(new BearerTokenAuthenticationFilter(tokenService, serverUrlResolver, objectMapper),
                        AuthorizationFilter.class)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(csrf -> csrf.disable());

        return http.build();
    }

    /**
     * Discovery, authorize, token and health endpoints are public. The consent form carries
     * no server-side session, so CSRF tokens do not apply.
     */
    @Bean
    @Order(2)
    public SecurityFilterChain defaultSecurityFilterChain(HttpSecurity http) throws Exception {
        http
                .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(csrf -> csrf.disable())
                .headers(headers -> headers
                        .contentSecurityPolicy(csp -> csp.policyDirectives("frame-ancestors 'self'")));

        return http.build();
    }
}
