package com.wpanther.memorygateway.service;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Set;

/**
 * PKCE (Proof Key for Code Exchange) checks.
 *
 * The client sends code_challenge = BASE64URL(SHA256(code_verifier)) when asking for a
 * code and the verifier itself when redeeming it.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Service
public class PkceService {

    public static final String METHOD_S256 = "S256";
    public static final String METHOD_PLAIN = "plain";

    private static final Set<String> SUPPORTED_METHODS = Set.of(METHOD_S256, METHOD_PLAIN);

    public boolean isSupportedMethod(String method) {
        return method != null && SUPPORTED_METHODS.contains(method);
    }

    /**
     * code_challenge = BASE64URL-NOPAD(SHA256(ASCII(code_verifier)))
     */
    public String generateCodeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Recomputes the challenge from the verifier and compares in constant time.
     */
    public boolean verifyCodeChallenge(String codeVerifier, String codeChallenge, String method) {
        if (codeVerifier == null || codeChallenge == null) {
            return false;
        }
        String expected;
        if (METHOD_S256.equals(method)) {
            expected = generateCodeChallenge(codeVerifier);
        } else if (METHOD_PLAIN.equals(method)) {
            expected = codeVerifier;
        } else {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                codeChallenge.getBytes(StandardCharsets.US_ASCII));
    }
}
