package com.vcc.traingateway.crypto;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Generates bearer tokens and computes their one-way digests.
 * Client keys are {@code cnp_live_} + 32 random bytes (base64url); generated account keys mimic
 * the provider's {@code sk-ant-api03-} shape. Only SHA-256 hex digests are ever persisted for lookup.
 */
@Service
public class KeyGeneratorService {

    public static final String CLIENT_KEY_PREFIX = "cnp_live_";
    public static final String ACCOUNT_KEY_PREFIX = "sk-ant-api03-";

    private static final int KEY_RANDOM_BYTES = 32;  // 256 bits of randomness
    private static final int ACCOUNT_KEY_RANDOM_BYTES = 72;
    private static final int DISPLAY_PREFIX_LENGTH = 12;
    private static final int DISPLAY_SUFFIX_LENGTH = 4;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Generate a tenant client key.
     *
     * @return GeneratedKey containing plaintext, display prefix/suffix, and hash
     */
    public GeneratedKey generateClientKey() {
        return generate(CLIENT_KEY_PREFIX, KEY_RANDOM_BYTES);
    }

    /**
     * Generate a broker-minted account API key.
     */
    public GeneratedKey generateAccountKey() {
        return generate(ACCOUNT_KEY_PREFIX, ACCOUNT_KEY_RANDOM_BYTES);
    }

    private GeneratedKey generate(String prefix, int randomBytes) {
        byte[] bytes = new byte[randomBytes];
        secureRandom.nextBytes(bytes);
        String fullKey = prefix + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return new GeneratedKey(fullKey, displayPrefix(fullKey), displaySuffix(fullKey), hash(fullKey));
    }

    /**
     * Hash a token using SHA-256.
     *
     * @return 64-character lowercase hex string
     */
    public String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Constant-time comparison of a presented token against a stored digest.
     */
    public boolean matches(String token, String storedHash) {
        if (token == null || storedHash == null) {
            return false;
        }
        return MessageDigest.isEqual(
                hash(token).getBytes(StandardCharsets.US_ASCII),
                storedHash.getBytes(StandardCharsets.US_ASCII));
    }

    public String displayPrefix(String token) {
        if (token == null || token.length() < 8) {
            return "****";
        }
        return token.substring(0, Math.min(DISPLAY_PREFIX_LENGTH, token.length()));
    }

    public String displaySuffix(String token) {
        if (token == null || token.length() < 8) {
            return "";
        }
        return token.substring(token.length() - DISPLAY_SUFFIX_LENGTH);
    }

    /**
     * Masked preview of a secret: {@code ****} plus the last four characters.
     */
    public static String maskSecret(String secret) {
        String hint = secretHint(secret);
        return hint != null ? "****" + hint : "****";
    }

    /**
     * Last four characters of a secret, or null when it is too short to reveal any.
     */
    public static String secretHint(String secret) {
        if (secret == null || secret.length() < 8) {
            return null;
        }
        return secret.substring(secret.length() - DISPLAY_SUFFIX_LENGTH);
    }

    /**
     * Result of key generation: plaintext (returned once), display fragments, and hash.
     */
    public record GeneratedKey(
            String plaintext,  // Full key - only returned once at creation
            String prefix,     // Display prefix (e.g., cnp_live_dGh)
            String suffix,     // Last four characters
            String hash        // SHA-256 hash for storage (64 hex chars)
    ) {}
}
