package com.vcc.traingateway.crypto;

import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.exception.CredentialCorruptionException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AES-256-GCM encryption for account secrets at rest.
 * <p>
 * Ciphertexts are stored as a self-describing envelope
 * {@code v<keyVersion>:<base64 iv>:<base64 ciphertext+tag>} so that the master key can be
 * rotated without rewriting every row at once. The master key is loaded once at startup,
 * inline value first, then the key file; startup fails when neither yields at least 32 bytes.
 */
@Service
public class AesGcmCryptoService {
    private static final Logger log = LoggerFactory.getLogger(AesGcmCryptoService.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;  // 96 bits
    private static final int GCM_TAG_LENGTH = 128; // bits
    private static final int MIN_KEY_BYTES = 32;
    private static final String FILE_PREFIX = "file:";

    private final GwProperties properties;
    private final SecureRandom secureRandom = new SecureRandom();
    private final Map<Integer, SecretKey> masterKeys = new ConcurrentHashMap<>();
    private volatile int currentKeyVersion;

    public AesGcmCryptoService(GwProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        GwProperties.CryptoConfig crypto = properties.getCrypto();
        this.currentKeyVersion = crypto.getCurrentKeyVersion();

        if (crypto.getMasterKey() != null && !crypto.getMasterKey().isBlank()) {
            registerKey(currentKeyVersion, crypto.getMasterKey().getBytes(StandardCharsets.UTF_8));
            log.info("Loaded master key v{} from inline configuration", currentKeyVersion);
        } else {
            String masterKeyPath = crypto.getMasterKeyPath();
            if (masterKeyPath == null || masterKeyPath.isBlank()) {
                throw new IllegalStateException("No master key configured (gw.crypto.master-key or master-key-path)");
            }
            registerKey(currentKeyVersion, loadKeyFile(masterKeyPath, currentKeyVersion));
            log.info("Loaded master key v{} from {}", currentKeyVersion, masterKeyPath);
        }

        loadPreviousKeys(crypto.getPreviousKeys());
    }

    /**
     * Retired key versions, kept for decrypting rows written before a rotation.
     * A value prefixed with {@code file:} is a key file path, anything else is inline key material.
     */
    private void loadPreviousKeys(Map<Integer, String> previousKeys) {
        if (previousKeys == null) {
            return;
        }
        for (Map.Entry<Integer, String> entry : previousKeys.entrySet()) {
            int version = entry.getKey();
            String value = entry.getValue();
            if (version == currentKeyVersion) {
                throw new IllegalStateException(
                        "gw.crypto.previous-keys must not redefine the current key version v" + version);
            }
            if (value == null || value.isBlank()) {
                throw new IllegalStateException("Previous master key v" + version + " is empty");
            }
            if (value.startsWith(FILE_PREFIX)) {
                String path = value.substring(FILE_PREFIX.length());
                registerKey(version, loadKeyFile(path, version));
                log.info("Loaded previous master key v{} from {} (decrypt only)", version, path);
            } else {
                registerKey(version, value.getBytes(StandardCharsets.UTF_8));
                log.info("Loaded previous master key v{} from inline configuration (decrypt only)", version);
            }
        }
    }

    private byte[] loadKeyFile(String path, int version) {
        try {
            return readKeyFile(path, version);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load master key v" + version + " from " + path, e);
        }
    }

    /**
     * Register key material under a version. Older versions stay available for decryption.
     * Accepts raw bytes or base64; anything other than exactly 32 bytes is stretched with SHA-256.
     */
    public void registerKey(int version, byte[] material) {
        byte[] keyBytes = decodeKeyMaterial(material);
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException(
                    "Master key must be at least " + MIN_KEY_BYTES + " bytes, got " + keyBytes.length);
        }
        if (keyBytes.length != MIN_KEY_BYTES) {
            keyBytes = sha256(keyBytes);
        }
        masterKeys.put(version, new SecretKeySpec(keyBytes, "AES"));
    }

    private byte[] readKeyFile(String path, int version) throws IOException {
        Path keyPath = Path.of(path);
        if (!Files.exists(keyPath)) {
            // Try versioned path: /etc/gw/master.key.v1
            keyPath = Path.of(path + ".v" + version);
        }
        if (!Files.exists(keyPath)) {
            throw new IOException("Master key file not found: " + path);
        }
        return Files.readAllBytes(keyPath);
    }

    private byte[] decodeKeyMaterial(byte[] material) {
        String text = new String(material, StandardCharsets.UTF_8).trim();
        if (text.length() > MIN_KEY_BYTES) {
            try {
                byte[] decoded = Base64.getDecoder().decode(text);
                if (decoded.length >= MIN_KEY_BYTES) {
                    return decoded;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Master key is not base64, using raw bytes");
            }
        }
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Encrypt plaintext with the current key version.
     *
     * @param plaintext The secret to encrypt (may be empty)
     * @param aad       Additional authenticated data binding the ciphertext to its row and column
     * @return envelope string safe to store in a text column
     */
    public String encrypt(String plaintext, String aad) {
        SecretKey key = masterKeys.get(currentKeyVersion);
        if (key == null) {
            throw new IllegalStateException("Master key v" + currentKeyVersion + " not loaded");
        }

        byte[] iv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(iv);

        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            if (aad != null && !aad.isEmpty()) {
                cipher.updateAAD(aad.getBytes(StandardCharsets.UTF_8));
            }
            byte[] ciphertextWithTag = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            Base64.Encoder encoder = Base64.getEncoder();
            return "v" + currentKeyVersion + ":" + encoder.encodeToString(iv) + ":"
                    + encoder.encodeToString(ciphertextWithTag);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * Decrypt an envelope produced by {@link #encrypt}.
     *
     * @throws CredentialCorruptionException when the envelope is malformed, the tag does not
     *                                       verify, or the key version is unknown
     */
    public String decrypt(String envelope, String aad) {
        if (envelope == null) {
            throw new CredentialCorruptionException("Secret is missing");
        }
        String[] parts = envelope.split(":", -1);
        if (parts.length != 3 || !parts[0].startsWith("v")) {
            throw new CredentialCorruptionException("Malformed secret envelope");
        }

        int version;
        byte[] iv;
        byte[] ciphertextWithTag;
        try {
            version = Integer.parseInt(parts[0].substring(1));
            iv = Base64.getDecoder().decode(parts[1]);
            ciphertextWithTag = Base64.getDecoder().decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new CredentialCorruptionException("Malformed secret envelope", e);
        }

        SecretKey key = masterKeys.get(version);
        if (key == null) {
            throw new CredentialCorruptionException("Master key v" + version + " not loaded for decryption");
        }

        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            if (aad != null && !aad.isEmpty()) {
                cipher.updateAAD(aad.getBytes(StandardCharsets.UTF_8));
            }
            return new String(cipher.doFinal(ciphertextWithTag), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new CredentialCorruptionException("Secret failed authentication (tampered or wrong key)", e);
        } catch (GeneralSecurityException e) {
            throw new CredentialCorruptionException("Secret could not be decrypted", e);
        }
    }

    /**
     * Get current key version for new encryptions.
     */
    public int getCurrentKeyVersion() {
        return currentKeyVersion;
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
