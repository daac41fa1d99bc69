package com.wpanther.memorygateway.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.wpanther.memorygateway.config.OAuthProperties;
import com.wpanther.memorygateway.entity.AuthorizationCode;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * authorization_codes.json, keyed by code. Used codes stay on file.
 */
@Repository
public class AuthorizationCodeRepository {

    static final String FILE_NAME = "authorization_codes.json";

    private final JsonFileStore<AuthorizationCode> store;

    public AuthorizationCodeRepository(OAuthProperties properties) {
        this.store = new JsonFileStore<>(
                properties.getStorageDir().resolve(FILE_NAME),
                JsonFileStore.recordMapper(),
                new TypeReference<LinkedHashMap<String, AuthorizationCode>>() {});
    }

    public Optional<AuthorizationCode> findByCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(store.readAll().get(code));
    }

    public AuthorizationCode save(AuthorizationCode authorizationCode) {
        return store.update(codes -> {
            codes.put(authorizationCode.getCode(), authorizationCode);
            return authorizationCode;
        });
    }

    /**
     * Atomic read-modify-write; an exception thrown by the mutation leaves the file untouched.
     */
    public <R> R update(Function<Map<String, AuthorizationCode>, R> mutation) {
        return store.update(mutation);
    }
}
