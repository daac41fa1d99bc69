package com.wpanther.memorygateway.service;

import com.wpanther.memorygateway.config.OAuthProperties;
import com.wpanther.memorygateway.service.ClientSecretService.HashingScheme;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;

import java.security.SecureRandom;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ClientSecretServiceTest {

    private final SecureRandom secureRandom = new SecureRandom();
    private ClientSecretService clientSecretService;

    @BeforeEach
    void setUp() {
        clientSecretService = new ClientSecretService(HashingScheme.BCRYPT,
                ClientSecretService.defaultEncoders(4, secureRandom), secureRandom);
    }

    @Test
    void testGenerateClientSecretIsUrlSafeAndUnique() {
        String first = clientSecretService.generateClientSecret();
        String second = clientSecretService.generateClientSecret();

        assertThat(first).hasSize(64).matches("[A-Za-z0-9_-]+");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void testHashAndVerify() {
        String secret = clientSecretService.generateClientSecret();

        String hash = clientSecretService.hashClientSecret(secret);

        assertThat(hash).startsWith("{bcrypt}").doesNotContain(secret);
        assertThat(clientSecretService.verifyClientSecret(secret, hash)).isTrue();
        assertThat(clientSecretService.verifyClientSecret(secret + "x", hash)).isFalse();
    }

    @Test
    void testHashRejectsEmptySecret() {
        assertThatThrownBy(() -> clientSecretService.hashClientSecret(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testVerifyNeverThrowsOnBadInput() {
        assertThat(clientSecretService.verifyClientSecret(null, "{bcrypt}x")).isFalse();
        assertThat(clientSecretService.verifyClientSecret("secret", null)).isFalse();
        assertThat(clientSecretService.verifyClientSecret("secret", "{md5}abc")).isFalse();
        assertThat(clientSecretService.verifyClientSecret("secret", "{bcrypt}not-a-hash")).isFalse();
        assertThat(clientSecretService.verifyClientSecret("secret", "{pbkdf2}zz")).isFalse();
    }

    @Test
    void testLegacyUnprefixedBcryptHashVerifiesAndNeedsRehash() {
        String legacy = new BCryptPasswordEncoder(4).encode("legacy-secret");

        assertThat(clientSecretService.verifyClientSecret("legacy-secret", legacy)).isTrue();
        assertThat(clientSecretService.needsRehash(legacy)).isTrue();
    }

    @Test
    void testFallsBackToPbkdf2WhenBcryptBackendFails() {
        PasswordEncoder broken = mock(PasswordEncoder.class);
        when(broken.encode(anyString())).thenThrow(new IllegalStateException("backend unavailable"));
        Map<HashingScheme, PasswordEncoder> encoders = new EnumMap<>(HashingScheme.class);
        encoders.put(HashingScheme.BCRYPT, broken);
        encoders.put(HashingScheme.PBKDF2, Pbkdf2PasswordEncoder.defaultsForSpringSecurity_v5_8());
        ClientSecretService service = new ClientSecretService(HashingScheme.BCRYPT, encoders, secureRandom);

        String hash = service.hashClientSecret("secret");

        assertThat(hash).startsWith("{pbkdf2}");
        assertThat(service.verifyClientSecret("secret", hash)).isTrue();
        assertThat(service.needsRehash(hash)).isTrue();
    }

    @Test
    void testBackendFailureOnVerifyReturnsFalse() {
        PasswordEncoder broken = mock(PasswordEncoder.class);
        when(broken.matches(anyString(), anyString())).thenThrow(new IllegalStateException("backend unavailable"));
        Map<HashingScheme, PasswordEncoder> encoders = new EnumMap<>(HashingScheme.class);
        encoders.put(HashingScheme.BCRYPT, broken);
        ClientSecretService service = new ClientSecretService(HashingScheme.BCRYPT, encoders, secureRandom);

        assertThat(service.verifyClientSecret("secret", "{bcrypt}$2a$04$abc")).isFalse();
    }

    @Test
    void testNoBackendAvailable() {
        PasswordEncoder broken = mock(PasswordEncoder.class);
        when(broken.encode(anyString())).thenThrow(new IllegalStateException("backend unavailable"));
        Map<HashingScheme, PasswordEncoder> encoders = new EnumMap<>(HashingScheme.class);
        encoders.put(HashingScheme.BCRYPT, broken);
        ClientSecretService service = new ClientSecretService(HashingScheme.BCRYPT, encoders, secureRandom);

        assertThatThrownBy(() -> service.hashClientSecret("secret"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testPreferredSchemeHashDoesNotNeedRehash() {
        String hash = clientSecretService.hashClientSecret("secret");

        assertThat(clientSecretService.needsRehash(hash)).isFalse();
        assertThat(clientSecretService.schemeOf(hash)).isEqualTo(HashingScheme.BCRYPT);
    }

    @Test
    void testSchemeFromId() {
        assertThat(HashingScheme.fromId("PBKDF2")).isEqualTo(HashingScheme.PBKDF2);
        assertThatThrownBy(() -> HashingScheme.fromId("argon2"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testContainerBuildsServiceFromProperties() {
        new ApplicationContextRunner()
                .withBean(OAuthProperties.class, () -> {
                    OAuthProperties properties = new OAuthProperties();
                    properties.getHashing().setBcryptStrength(4);
                    return properties;
                })
                .withBean(SecureRandom.class, () -> secureRandom)
                .withUserConfiguration(ClientSecretService.class)
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    ClientSecretService service = context.getBean(ClientSecretService.class);
                    String hash = service.hashClientSecret("secret");
                    assertThat(hash).startsWith("{bcrypt}");
                    assertThat(service.verifyClientSecret("secret", hash)).isTrue();
                });
    }
}
