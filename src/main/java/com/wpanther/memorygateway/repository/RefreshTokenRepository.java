package com.wpanther.memorygateway.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.wpanther.memorygateway.config.OAuthProperties;
import com.wpanther.memorygateway.entity.RefreshToken;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * refresh_tokens.json, keyed by token hash.
 */
@Repository
public class RefreshTokenRepository {

    static final String FILE_NAME = "refresh_tokens.json";

    private final JsonFileStore<RefreshToken> store;

    public RefreshTokenRepository(OAuthProperties properties) {
        this.store = new JsonFileStore<>(
                properties.getStorageDir().resolve(FILE_NAME),
                JsonFileStore.recordMapper(),
                new TypeReference<LinkedHashMap<String, RefreshToken>>() {});
    }

    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        return Optional.ofNullable(store.readAll().get(tokenHash));
    }

    public RefreshToken save(RefreshToken refreshToken) {
        return store.update(tokens -> {
            tokens.put(refreshToken.getTokenHash(), refreshToken);
            return refreshToken;
        });
    }

    public <R> R update(Function<Map<String, RefreshToken>, R> mutation) {
        return store.update(mutation);
    }
}
