package com.wpanther.memorygateway.service;

import com.wpanther.memorygateway.config.OAuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.crypto.password.Pbkdf2PasswordEncoder;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generates, hashes and verifies client secrets.
 *
 * Hashes are stored as {@code {scheme}encoded}. New hashes use the preferred scheme;
 * when its backend fails the next scheme is used instead. Verification never throws.
 */
@Service
@Slf4j
public class ClientSecretService {

    private static final int SECRET_BYTES = 48;

    public enum HashingScheme {
        BCRYPT("bcrypt"),
        PBKDF2("pbkdf2");

        private final String id;

        HashingScheme(String id) {
            this.id = id;
        }

        public String getId() {
            return id;
        }

        public String prefix() {
            return "{" + id + "}";
        }

        public static HashingScheme fromId(String id) {
            for (HashingScheme scheme : values()) {
                if (scheme.id.equals(id.toLowerCase(Locale.ROOT))) {
                    return scheme;
                }
            }
            throw new IllegalArgumentException("Unknown hashing scheme: " + id);
        }
    }

    private final SecureRandom secureRandom;
    private final Map<HashingScheme, PasswordEncoder> encoders;
    private final HashingScheme preferredScheme;

    @Autowired
    public ClientSecretService(OAuthProperties properties, SecureRandom secureRandom) {
        this(HashingScheme.fromId(properties.getHashing().getPreferredScheme()),
                defaultEncoders(properties.getHashing().getBcryptStrength(), secureRandom),
                secureRandom);
    }

    ClientSecretService(HashingScheme preferredScheme, Map<HashingScheme, PasswordEncoder> encoders,
                        SecureRandom secureRandom) {
        this.preferredScheme = preferredScheme;
        this.encoders = new EnumMap<>(encoders);
        this.secureRandom = secureRandom;
    }

    static Map<HashingScheme, PasswordEncoder> defaultEncoders(int bcryptStrength, SecureRandom secureRandom) {
        Map<HashingScheme, PasswordEncoder> encoders = new EnumMap<>(HashingScheme.class);
        encoders.put(HashingScheme.BCRYPT, new BCryptPasswordEncoder(bcryptStrength, secureRandom));
        encoders.put(HashingScheme.PBKDF2, Pbkdf2PasswordEncoder.defaultsForSpringSecurity_v5_8());
        return encoders;
    }

    public String generateClientSecret() {
        byte[] randomBytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    /**
     * Hashes with the preferred scheme, falling back through the remaining schemes.
     *
     * @throws IllegalStateException when no scheme can produce a hash
     */
    public String hashClientSecret(String clientSecret) {
        if (clientSecret == null || clientSecret.isEmpty()) {
            throw new IllegalArgumentException("Client secret cannot be empty");
        }
        for (HashingScheme scheme : schemesInPreferenceOrder()) {
            PasswordEncoder encoder = encoders.get(scheme);
            if (encoder == null) {
                continue;
            }
            try {
                return scheme.prefix() + encoder.encode(clientSecret);
            } catch (RuntimeException e) {
                log.warn("Hashing backend {} unavailable, trying next scheme: {}", scheme.getId(), e.getMessage());
            }
        }
        throw new IllegalStateException("No password hashing backend available");
    }

    public boolean verifyClientSecret(String rawClientSecret, String hashedClientSecret) {
        if (rawClientSecret == null || hashedClientSecret == null) {
            return false;
        }
        HashingScheme scheme = schemeOf(hashedClientSecret);
        if (scheme == null) {
            log.warn("Stored client secret hash uses an unrecognised scheme");
            return false;
        }
        PasswordEncoder encoder = encoders.get(scheme);
        if (encoder == null) {
            log.error("No {} backend configured; client secret cannot be verified", scheme.getId());
            return false;
        }
        try {
            return encoder.matches(rawClientSecret, encodedPart(hashedClientSecret, scheme));
        } catch (IllegalArgumentException e) {
            log.warn("Malformed {} client secret hash", scheme.getId());
            return false;
        } catch (RuntimeException e) {
            // misconfigured server, not a wrong secret
            log.error("Hashing backend {} failed while verifying a client secret", scheme.getId(), e);
            return false;
        }
    }

    /**
     * Whether a verified hash should be rewritten with the preferred scheme.
     */
    public boolean needsRehash(String hashedClientSecret) {
        HashingScheme scheme = schemeOf(hashedClientSecret);
        if (scheme != preferredScheme || !hashedClientSecret.startsWith(scheme.prefix())) {
            return true;
        }
        PasswordEncoder encoder = encoders.get(scheme);
        try {
            return encoder.upgradeEncoding(encodedPart(hashedClientSecret, scheme));
        } catch (RuntimeException e) {
            return false;
        }
    }

    public HashingScheme getPreferredScheme() {
        return preferredScheme;
    }

    HashingScheme schemeOf(String hashedClientSecret) {
        if (hashedClientSecret == null) {
            return null;
        }
        for (HashingScheme scheme : HashingScheme.values()) {
            if (hashedClientSecret.startsWith(scheme.prefix())) {
                return scheme;
            }
        }
        // unprefixed modular-crypt bcrypt from older clients.json files
        if (hashedClientSecret.startsWith("$2a$") || hashedClientSecret.startsWith("$2b$")
                || hashedClientSecret.startsWith("$2y$")) {
            return HashingScheme.BCRYPT;
        }
        return null;
    }

    private static String encodedPart(String hashedClientSecret, HashingScheme scheme) {
        return hashedClientSecret.startsWith(scheme.prefix())
                ? hashedClientSecret.substring(scheme.prefix().length())
                : hashedClientSecret;
    }

    private List<HashingScheme> schemesInPreferenceOrder() {
        List<HashingScheme> order = new ArrayList<>();
        order.add(preferredScheme);
        for (HashingScheme scheme : HashingScheme.values()) {
            if (scheme != preferredScheme) {
                order.add(scheme);
            }
        }
        return order;
    }
}
