package io.factorialsystems.oauthserver.service;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Generates opaque credentials (codes, tokens, client secrets) and the digests they are stored under.
 * Raw values leave the server once, in the response that issues them.
 */
@Component
public class SecureTokenGenerator {

    private static final int TOKEN_BYTES = 32; // 256 bits
    private static final int CLIENT_ID_BYTES = 16;
    private static final SecureRandom secureRandom = new SecureRandom();

    public String generateToken() {
        return randomUrlSafe(TOKEN_BYTES);
    }

    public String generateClientId() {
        return randomUrlSafe(CLIENT_ID_BYTES);
    }

    /**
     * Hex SHA-256 of the value. Lookups go through the digest so a leaked table holds no usable tokens.
     */
    public String hash(String value) {
        return HexFormat.of().formatHex(sha256(value.getBytes(StandardCharsets.UTF_8)));
    }

    static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String randomUrlSafe(int byteCount) {
        byte[] bytes = new byte[byteCount];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
