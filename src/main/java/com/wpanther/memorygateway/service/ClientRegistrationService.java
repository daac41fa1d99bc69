package com.wpanther.memorygateway.service;

import com.wpanther.memorygateway.dto.ClientRegistrationResponse;
import com.wpanther.memorygateway.dto.ClientSummary;
import com.wpanther.memorygateway.entity.OAuth2Client;
import com.wpanther.memorygateway.exception.ClientRegistrationException;
import com.wpanther.memorygateway.repository.OAuth2ClientRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Client registry: generation, lookup, revocation and credential checks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClientRegistrationService {

    public static final String CLIENT_ID_PREFIX = "smc_";
    private static final int CLIENT_ID_BYTES = 16;

    private final OAuth2ClientRepository oauth2ClientRepository;
    private final ClientSecretService clientSecretService;
    private final SecureRandom secureRandom;
    private final Clock clock;

    /**
     * Creates a client. The plaintext secret is only ever returned here.
     */
    public ClientRegistrationResponse generateClient(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new ClientRegistrationException("Client name is required");
        }

        String rawClientSecret = clientSecretService.generateClientSecret();
        String hashedClientSecret = clientSecretService.hashClientSecret(rawClientSecret);

        OAuth2Client client = oauth2ClientRepository.update(clients -> {
            String clientId = generateClientId();
            while (clients.containsKey(clientId)) {
                clientId = generateClientId();
            }
            OAuth2Client created = OAuth2Client.builder()
                    .clientId(clientId)
                    .name(name.trim())
                    .description(description != null ? description : "")
                    .secretHash(hashedClientSecret)
                    .createdAt(Instant.now(clock))
                    .revoked(false)
                    .build();
            clients.put(clientId, created);
            return created;
        });

        log.info("Generated OAuth client {} ({})", client.getClientId(), client.getName());

        return ClientRegistrationResponse.builder()
                .clientId(client.getClientId())
                .clientSecret(rawClientSecret)
                .name(client.getName())
                .description(client.getDescription())
                .createdAt(client.getCreatedAt())
                .build();
    }

    public List<ClientSummary> listClients() {
        return oauth2ClientRepository.findAll().stream()
                .map(ClientSummary::from)
                .collect(Collectors.toList());
    }

    public Optional<ClientSummary> getClient(String clientId) {
        return oauth2ClientRepository.findByClientId(clientId).map(ClientSummary::from);
    }

    /**
     * Client that exists and has not been revoked.
     */
    public Optional<OAuth2Client> findActiveClient(String clientId) {
        return oauth2ClientRepository.findByClientId(clientId).filter(client -> !client.isRevoked());
    }

    /**
     * Revokes a client. Idempotent: the first revocation time is kept.
     *
     * @return false only when the client does not exist
     */
    public boolean revokeClient(String clientId) {
        if (clientId == null) {
            return false;
        }
        boolean found = oauth2ClientRepository.update(clients -> {
            OAuth2Client client = clients.get(clientId);
            if (client == null) {
                return false;
            }
            if (!client.isRevoked()) {
                client.setRevoked(true);
                client.setRevokedAt(Instant.now(clock));
            }
            return true;
        });
        if (found) {
            log.info("Revoked OAuth client {}", clientId);
        } else {
            log.warn("Revocation requested for unknown client {}", clientId);
        }
        return found;
    }

    public boolean verifyClient(String clientId, String clientSecret) {
        Optional<OAuth2Client> client = oauth2ClientRepository.findByClientId(clientId);
        if (client.isEmpty()) {
            log.debug("Credential check for unknown client {}", clientId);
            return false;
        }
        if (client.get().isRevoked()) {
            log.debug("Credential check for revoked client {}", clientId);
            return false;
        }

        String storedHash = client.get().getSecretHash();
        if (!clientSecretService.verifyClientSecret(clientSecret, storedHash)) {
            return false;
        }
        if (clientSecretService.needsRehash(storedHash)) {
            upgradeSecretHash(clientId, clientSecret, storedHash);
        }
        return true;
    }

    private void upgradeSecretHash(String clientId, String clientSecret, String previousHash) {
        String upgraded = clientSecretService.hashClientSecret(clientSecret);
        oauth2ClientRepository.update(clients -> {
            OAuth2Client client = clients.get(clientId);
            // skip if the record changed since it was verified
            if (client != null && previousHash.equals(client.getSecretHash())) {
                client.setSecretHash(upgraded);
            }
            return null;
        });
        log.info("Upgraded secret hash of client {} to {}", clientId,
                clientSecretService.getPreferredScheme().getId());
    }

    private String generateClientId() {
        byte[] randomBytes = new byte[CLIENT_ID_BYTES];
        secureRandom.nextBytes(randomBytes);
        return CLIENT_ID_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }
}
