package com.vcc.traingateway.crypto;

import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.exception.CredentialCorruptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AesGcmCryptoServiceTest {

    private static final String KEY_A = "0123456789abcdef0123456789abcdef";
    private static final String KEY_B = "fedcba9876543210fedcba9876543210";
    private static final String AAD = "account:acc_1:api_key";

    private AesGcmCryptoService cryptoService;

    @BeforeEach
    void setUp() {
        cryptoService = newService(KEY_A, 1);
    }

    private static AesGcmCryptoService newService(String masterKey, int version) {
        GwProperties properties = new GwProperties();
        properties.getCrypto().setMasterKey(masterKey);
        properties.getCrypto().setCurrentKeyVersion(version);
        AesGcmCryptoService service = new AesGcmCryptoService(properties);
        service.init();
        return service;
    }

    @Test
    void encryptThenDecrypt_returnsPlaintext() {
        String secret = "sk-ant-REDACTED";

        String envelope = cryptoService.encrypt(secret, AAD);

        assertTrue(envelope.startsWith("v1:"));
        assertEquals(secret, cryptoService.decrypt(envelope, AAD));
    }

    @Test
    void encrypt_handlesEmptyAndNonAsciiPlaintext() {
        String unicode = "tökén-🔑-秘密";

        assertEquals("", cryptoService.decrypt(cryptoService.encrypt("", AAD), AAD));
        assertEquals(unicode, cryptoService.decrypt(cryptoService.encrypt(unicode, AAD), AAD));
    }

    @Test
    void encrypt_usesFreshIvPerCall() {
        String first = cryptoService.encrypt("same", AAD);
        String second = cryptoService.encrypt("same", AAD);

        assertNotEquals(first, second);
    }

    @Test
    void decrypt_withDifferentMasterKey_failsAsCorruption() {
        String envelope = cryptoService.encrypt("secret", AAD);
        AesGcmCryptoService other = newService(KEY_B, 1);

        assertThrows(CredentialCorruptionException.class, () -> other.decrypt(envelope, AAD));
    }

    @Test
    void decrypt_tamperedCiphertext_failsAsCorruption() {
        String envelope = cryptoService.encrypt("secret", AAD);
        String[] parts = envelope.split(":");
        byte[] body = Base64.getDecoder().decode(parts[2]);
        body[0] ^= 0x01;
        String tampered = parts[0] + ":" + parts[1] + ":" + Base64.getEncoder().encodeToString(body);

        assertThrows(CredentialCorruptionException.class, () -> cryptoService.decrypt(tampered, AAD));
    }

    @Test
    void decrypt_withOtherRowsAad_failsAsCorruption() {
        String envelope = cryptoService.encrypt("secret", AAD);

        assertThrows(CredentialCorruptionException.class,
                () -> cryptoService.decrypt(envelope, "account:acc_2:api_key"));
        assertThrows(CredentialCorruptionException.class,
                () -> cryptoService.decrypt(envelope, "account:acc_1:oauth_refresh"));
    }

    @Test
    void decrypt_malformedEnvelope_failsAsCorruption() {
        assertThrows(CredentialCorruptionException.class, () -> cryptoService.decrypt("not-an-envelope", AAD));
        assertThrows(CredentialCorruptionException.class, () -> cryptoService.decrypt("v1:%%%:%%%", AAD));
        assertThrows(CredentialCorruptionException.class, () -> cryptoService.decrypt(null, AAD));
    }

    @Test
    void decrypt_unknownKeyVersion_failsAsCorruption() {
        String envelope = cryptoService.encrypt("secret", AAD);
        String future = "v9" + envelope.substring(2);

        assertThrows(CredentialCorruptionException.class, () -> cryptoService.decrypt(future, AAD));
    }

    @Test
    void rotatedKey_stillDecryptsOlderVersion() {
        String oldEnvelope = cryptoService.encrypt("secret", AAD);

        AesGcmCryptoService rotated = newService(KEY_B, 2);
        rotated.registerKey(1, KEY_A.getBytes(StandardCharsets.UTF_8));

        assertEquals("secret", rotated.decrypt(oldEnvelope, AAD));
        assertTrue(rotated.encrypt("secret", AAD).startsWith("v2:"));
    }

    @Test
    void bumpedKeyVersion_decryptsOlderRowsFromConfiguredPreviousKey() {
        String oldEnvelope = cryptoService.encrypt("secret", AAD);

        GwProperties properties = new GwProperties();
        properties.getCrypto().setMasterKey(KEY_B);
        properties.getCrypto().setCurrentKeyVersion(2);
        properties.getCrypto().setPreviousKeys(Map.of(1, KEY_A));
        AesGcmCryptoService rotated = new AesGcmCryptoService(properties);
        rotated.init();

        assertEquals("secret", rotated.decrypt(oldEnvelope, AAD));
        assertTrue(rotated.encrypt("secret", AAD).startsWith("v2:"));
    }

    @Test
    void bumpedKeyVersion_loadsPreviousKeyFromFile(@TempDir Path dir) throws IOException {
        String oldEnvelope = cryptoService.encrypt("secret", AAD);
        Path oldKey = Files.writeString(dir.resolve("master.key.v1"), KEY_A);

        GwProperties properties = new GwProperties();
        properties.getCrypto().setMasterKey(KEY_B);
        properties.getCrypto().setCurrentKeyVersion(2);
        properties.getCrypto().setPreviousKeys(Map.of(1, "file:" + oldKey));
        AesGcmCryptoService rotated = new AesGcmCryptoService(properties);
        rotated.init();

        assertEquals("secret", rotated.decrypt(oldEnvelope, AAD));
    }

    @Test
    void bumpedKeyVersion_withoutPreviousKey_oldRowsAreCorrupt() {
        String oldEnvelope = cryptoService.encrypt("secret", AAD);
        AesGcmCryptoService rotated = newService(KEY_B, 2);

        assertThrows(CredentialCorruptionException.class, () -> rotated.decrypt(oldEnvelope, AAD));
    }

    @Test
    void init_rejectsPreviousKeyForCurrentVersion() {
        GwProperties properties = new GwProperties();
        properties.getCrypto().setMasterKey(KEY_B);
        properties.getCrypto().setCurrentKeyVersion(2);
        properties.getCrypto().setPreviousKeys(Map.of(2, KEY_A));

        assertThrows(IllegalStateException.class, () -> new AesGcmCryptoService(properties).init());
    }

    @Test
    void init_rejectsShortMasterKey() {
        GwProperties properties = new GwProperties();
        properties.getCrypto().setMasterKey("too-short");

        assertThrows(IllegalStateException.class, () -> new AesGcmCryptoService(properties).init());
    }

    @Test
    void init_acceptsBase64MasterKey() {
        byte[] raw = new byte[32];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = (byte) i;
        }
        AesGcmCryptoService service = newService(Base64.getEncoder().encodeToString(raw), 1);

        assertEquals("x", service.decrypt(service.encrypt("x", AAD), AAD));
    }
}
