package com.wpanther.memorygateway.repository;

import com.wpanther.memorygateway.config.OAuthProperties;
import com.wpanther.memorygateway.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide HMAC secret in secret_key.txt. Generated on first use, re-read on every call,
 * never rotated.
 */
@Repository
@Slf4j
public class SigningKeyRepository {

    static final String FILE_NAME = "secret_key.txt";
    private static final int KEY_BYTES = 64;

    private final Path keyFile;
    private final SecureRandom secureRandom;
    private final ReentrantLock createLock = new ReentrantLock();

    public SigningKeyRepository(OAuthProperties properties, SecureRandom secureRandom) {
        this.keyFile = properties.getStorageDir().resolve(FILE_NAME);
        this.secureRandom = secureRandom;
    }

    public byte[] getSecretKey() {
        try {
            if (!Files.exists(keyFile)) {
                createKey();
            }
            String key = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
            return key.getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Unable to read signing key {}", keyFile, e);
            throw new StorageException("Unable to read signing key", e);
        }
    }

    private void createKey() throws IOException {
        createLock.lock();
        try {
            if (Files.exists(keyFile)) {
                return;
            }
            JsonFileStore.ensureDirectory(keyFile.getParent());
            byte[] random = new byte[KEY_BYTES];
            secureRandom.nextBytes(random);
            Path temp = Files.createTempFile(keyFile.getParent(), FILE_NAME, ".tmp");
            try {
                JsonFileStore.restrict(temp, JsonFileStore.OWNER_ONLY_FILE);
                Files.writeString(temp, Base64.getUrlEncoder().withoutPadding().encodeToString(random),
                        StandardCharsets.UTF_8);
                Files.move(temp, keyFile);
            } finally {
                Files.deleteIfExists(temp);
            }
            JsonFileStore.restrict(keyFile, JsonFileStore.OWNER_ONLY_FILE);
            log.info("Generated new token signing key at {}", keyFile);
        } finally {
            createLock.unlock();
        }
    }
}
