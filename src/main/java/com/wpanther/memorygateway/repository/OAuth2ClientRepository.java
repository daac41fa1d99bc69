package com.wpanther.memorygateway.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.wpanther.memorygateway.config.OAuthProperties;
import com.wpanther.memorygateway.entity.OAuth2Client;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * clients.json, keyed by client id.
 */
@Repository
public class OAuth2ClientRepository {

    static final String FILE_NAME = "clients.json";

    private final JsonFileStore<OAuth2Client> store;

    public OAuth2ClientRepository(OAuthProperties properties) {
        this.store = new JsonFileStore<>(
                properties.getStorageDir().resolve(FILE_NAME),
                JsonFileStore.recordMapper(),
                new TypeReference<LinkedHashMap<String, OAuth2Client>>() {});
    }

    public Optional<OAuth2Client> findByClientId(String clientId) {
        if (clientId == null) {
            return Optional.empty();
        }
        OAuth2Client client = store.readAll().get(clientId);
        if (client != null && client.getClientId() == null) {
            client.setClientId(clientId);
        }
        return Optional.ofNullable(client);
    }

    public List<OAuth2Client> findAll() {
        List<OAuth2Client> clients = new ArrayList<>();
        store.readAll().forEach((clientId, client) -> {
            if (client.getClientId() == null) {
                client.setClientId(clientId);
            }
            clients.add(client);
        });
        return clients;
    }

    public OAuth2Client save(OAuth2Client client) {
        return store.update(clients -> {
            clients.put(client.getClientId(), client);
            return client;
        });
    }

    /**
     * Atomic read-modify-write over all client records.
     */
    public <R> R update(Function<Map<String, OAuth2Client>, R> mutation) {
        return store.update(mutation);
    }
}
