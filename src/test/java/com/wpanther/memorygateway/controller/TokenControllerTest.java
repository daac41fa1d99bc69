package com.wpanther.memorygateway.controller;

import com.wpanther.memorygateway.dto.TokenRequest;
import com.wpanther.memorygateway.exception.OAuth2Exception;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenControllerTest {

    @Test
    void testBasicCredentialsOverrideBody() {
        TokenRequest request = TokenRequest.builder().clientId("body-id").clientSecret("body-secret").build();

        TokenController.applyBasicCredentials(request, basic("smc_id:s3cr%3At"));

        assertThat(request.getClientId()).isEqualTo("smc_id");
        assertThat(request.getClientSecret()).isEqualTo("s3cr:t");
    }

    @Test
    void testSecretMayContainColon() {
        TokenRequest request = new TokenRequest();

        TokenController.applyBasicCredentials(request, basic("smc_id:a:b"));

        assertThat(request.getClientSecret()).isEqualTo("a:b");
    }

    @Test
    void testNonBasicAuthorizationIsIgnored() {
        TokenRequest request = TokenRequest.builder().clientId("body-id").build();

        TokenController.applyBasicCredentials(request, "Bearer abc");
        TokenController.applyBasicCredentials(request, null);

        assertThat(request.getClientId()).isEqualTo("body-id");
    }

    @Test
    void testMalformedBasicCredentials() {
        assertThatThrownBy(() -> TokenController.applyBasicCredentials(new TokenRequest(), "Basic !!!"))
                .isInstanceOfSatisfying(OAuth2Exception.class,
                        e -> assertThat(e.getError()).isEqualTo(OAuth2Exception.INVALID_CLIENT));
        assertThatThrownBy(() -> TokenController.applyBasicCredentials(new TokenRequest(), basic("no-separator")))
                .isInstanceOf(OAuth2Exception.class);
    }

    private static String basic(String credentials) {
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
