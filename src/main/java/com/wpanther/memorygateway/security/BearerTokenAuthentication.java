package com.wpanther.memorygateway.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.stream.Collectors;

/**
 * Authenticated bearer token. The principal is the verified {@link TokenClaims}; the name
 * is the client id.
 */
public class BearerTokenAuthentication extends AbstractAuthenticationToken {

    private final TokenClaims claims;
    private final String token;

    public BearerTokenAuthentication(TokenClaims claims, String token) {
        super(authoritiesOf(claims.getScope()));
        this.claims = claims;
        this.token = token;
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return token;
    }

    @Override
    public TokenClaims getPrincipal() {
        return claims;
    }

    @Override
    public String getName() {
        return claims.getSubject();
    }

    private static Collection<GrantedAuthority> authoritiesOf(String scope) {
        if (scope == null || scope.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(scope.trim().split("\\s+"))
                .map(value -> new SimpleGrantedAuthority("SCOPE_" + value))
                .collect(Collectors.toList());
    }
}
