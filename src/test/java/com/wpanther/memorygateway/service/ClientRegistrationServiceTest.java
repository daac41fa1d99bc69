package com.wpanther.memorygateway.service;

import com.wpanther.memorygateway.TestSupport;
import com.wpanther.memorygateway.dto.ClientRegistrationResponse;
import com.wpanther.memorygateway.dto.ClientSummary;
import com.wpanther.memorygateway.entity.OAuth2Client;
import com.wpanther.memorygateway.exception.ClientRegistrationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientRegistrationServiceTest {

    @TempDir
    Path storageDir;

    private TestSupport support;
    private ClientRegistrationService clientRegistrationService;

    @BeforeEach
    void setUp() {
        support = new TestSupport(storageDir);
        clientRegistrationService = support.clientRegistrationService(TestSupport.clockAt(TestSupport.NOW));
    }

    @Test
    void testGenerateClient() {
        // Act
        ClientRegistrationResponse response = clientRegistrationService.generateClient("Claude", "desktop connector");

        // Assert
        assertThat(response.getClientId()).startsWith(ClientRegistrationService.CLIENT_ID_PREFIX).hasSize(26);
        assertThat(response.getClientSecret()).isNotBlank();
        assertThat(response.getName()).isEqualTo("Claude");
        assertThat(response.getDescription()).isEqualTo("desktop connector");
        assertThat(response.getCreatedAt()).isEqualTo(TestSupport.NOW);

        OAuth2Client stored = support.clientRepository.findByClientId(response.getClientId()).orElseThrow();
        assertThat(stored.getSecretHash()).startsWith("{bcrypt}").doesNotContain(response.getClientSecret());
        assertThat(stored.isRevoked()).isFalse();
    }

    @Test
    void testGeneratedClientIdsAreUnique() {
        Set<String> ids = IntStream.range(0, 5)
                .mapToObj(i -> clientRegistrationService.generateClient("client " + i, null).getClientId())
                .collect(Collectors.toSet());

        assertThat(ids).hasSize(5);
        assertThat(clientRegistrationService.listClients()).hasSize(5);
    }

    @Test
    void testGenerateClientRequiresName() {
        assertThatThrownBy(() -> clientRegistrationService.generateClient("  ", null))
                .isInstanceOf(ClientRegistrationException.class)
                .hasMessageContaining("name");
        assertThat(clientRegistrationService.listClients()).isEmpty();
    }

    @Test
    void testSecretVerifiesAndNeverAppearsInListing() {
        ClientRegistrationResponse response = clientRegistrationService.generateClient("ChatGPT", null);

        assertThat(clientRegistrationService.verifyClient(response.getClientId(), response.getClientSecret())).isTrue();
        assertThat(clientRegistrationService.verifyClient(response.getClientId(), "wrong")).isFalse();
        assertThat(clientRegistrationService.verifyClient("smc_unknown", response.getClientSecret())).isFalse();

        List<ClientSummary> clients = clientRegistrationService.listClients();
        assertThat(clients).singleElement()
                .satisfies(summary -> {
                    assertThat(summary.getClientId()).isEqualTo(response.getClientId());
                    assertThat(summary.getDescription()).isEmpty();
                    assertThat(summary.toString()).doesNotContain(response.getClientSecret());
                });
    }

    @Test
    void testRevokeClient() {
        ClientRegistrationResponse response = clientRegistrationService.generateClient("Claude", null);

        assertThat(clientRegistrationService.revokeClient(response.getClientId())).isTrue();

        assertThat(clientRegistrationService.verifyClient(response.getClientId(), response.getClientSecret())).isFalse();
        assertThat(clientRegistrationService.findActiveClient(response.getClientId())).isEmpty();
        ClientSummary summary = clientRegistrationService.getClient(response.getClientId()).orElseThrow();
        assertThat(summary.isRevoked()).isTrue();
        assertThat(summary.getRevokedAt()).isEqualTo(TestSupport.NOW);
    }

    @Test
    void testRevokeIsIdempotentAndKeepsFirstRevocationTime() {
        ClientRegistrationResponse response = clientRegistrationService.generateClient("Claude", null);
        clientRegistrationService.revokeClient(response.getClientId());

        ClientRegistrationService later = support.clientRegistrationService(
                TestSupport.clockAt(TestSupport.NOW.plusSeconds(600)));

        assertThat(later.revokeClient(response.getClientId())).isTrue();
        assertThat(later.getClient(response.getClientId()).orElseThrow().getRevokedAt()).isEqualTo(TestSupport.NOW);
    }

    @Test
    void testRevokeUnknownClient() {
        assertThat(clientRegistrationService.revokeClient("smc_missing")).isFalse();
        assertThat(clientRegistrationService.revokeClient(null)).isFalse();
    }

    @Test
    void testLegacyHashIsUpgradedOnSuccessfulVerify() {
        // Arrange
        String legacyHash = new BCryptPasswordEncoder(4).encode("legacy-secret");
        support.clientRepository.save(OAuth2Client.builder()
                .clientId("smc_legacy")
                .name("Legacy")
                .secretHash(legacyHash)
                .createdAt(Instant.parse("2025-01-01T00:00:00Z"))
                .build());

        // Act
        boolean verified = clientRegistrationService.verifyClient("smc_legacy", "legacy-secret");

        // Assert
        assertThat(verified).isTrue();
        String upgraded = support.clientRepository.findByClientId("smc_legacy").orElseThrow().getSecretHash();
        assertThat(upgraded).startsWith("{bcrypt}").isNotEqualTo(legacyHash);
        assertThat(clientRegistrationService.verifyClient("smc_legacy", "legacy-secret")).isTrue();
    }
}
