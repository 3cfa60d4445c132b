package com.memoryvault.infrastructure.crypto;

import com.memoryvault.config.CryptoProperties;
import com.memoryvault.domain.model.EncryptedValue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCryptoServiceTest {

    private static final String KEY_ONE = Base64.getEncoder().encodeToString(new byte[32]);
    private static final String KEY_TWO = Base64.getEncoder().encodeToString(filled((byte) 7));

    private static byte[] filled(byte value) {
        byte[] key = new byte[32];
        Arrays.fill(key, value);
        return key;
    }

    private static CryptoProperties properties(String keyId, String key) {
        CryptoProperties properties = new CryptoProperties();
        properties.setMasterKeyId(keyId);
        properties.setMasterKey(key);
        return properties;
    }

    @Test
    void decryptsWhatItEncrypted() {
        EnvelopeCryptoService crypto = new EnvelopeCryptoService(properties("k1", KEY_ONE));
        byte[] plaintext = "the spare key is under the blue pot".getBytes(StandardCharsets.UTF_8);

        EncryptedValue value = crypto.encrypt(plaintext, "secret-content");

        assertEquals("k1", value.getKeyId());
        assertEquals(EncryptedValue.AES_256_GCM, value.getAlgorithm());
        assertFalse(new String(value.getCiphertext(), StandardCharsets.UTF_8).contains("blue pot"));
        assertArrayEquals(plaintext, crypto.decrypt(value, "secret-content"));
    }

    @Test
    void everyValueGetsItsOwnDataKey() {
        EnvelopeCryptoService crypto = new EnvelopeCryptoService(properties("k1", KEY_ONE));
        byte[] plaintext = "same".getBytes(StandardCharsets.UTF_8);

        EncryptedValue a = crypto.encrypt(plaintext, "voiceprint");
        EncryptedValue b = crypto.encrypt(plaintext, "voiceprint");

        assertFalse(Arrays.equals(a.getWrappedKey(), b.getWrappedKey()));
        assertFalse(Arrays.equals(a.getCiphertext(), b.getCiphertext()));
    }

    @Test
    void purposeIsBoundToTheCiphertext() {
        EnvelopeCryptoService crypto = new EnvelopeCryptoService(properties("k1", KEY_ONE));
        EncryptedValue value = crypto.encrypt(new byte[]{1, 2, 3}, "secret-content");

        assertThrows(CryptoException.class, () -> crypto.decrypt(value, "disclosure-content"));
    }

    @Test
    void tamperedCiphertextFailsAuthentication() {
        EnvelopeCryptoService crypto = new EnvelopeCryptoService(properties("k1", KEY_ONE));
        EncryptedValue value = crypto.encrypt(new byte[]{1, 2, 3, 4}, "secret-content");

        byte[] ciphertext = value.getCiphertext();
        ciphertext[0] ^= 0x01;
        EncryptedValue tampered = EncryptedValue.builder()
            .ciphertext(ciphertext)
            .wrappedKey(value.getWrappedKey())
            .keyId(value.getKeyId())
            .iv(value.getIv())
            .authTag(value.getAuthTag())
            .build();

        assertThrows(CryptoException.class, () -> crypto.decrypt(tampered, "secret-content"));
    }

    @Test
    void retiredKeyStillDecryptsAfterRotation() {
        EnvelopeCryptoService before = new EnvelopeCryptoService(properties("k1", KEY_ONE));
        EncryptedValue value = before.encrypt("kept".getBytes(StandardCharsets.UTF_8), "secret-content");

        CryptoProperties rotated = properties("k2", KEY_TWO);
        rotated.setRetiredKeys(Map.of("k1", KEY_ONE));
        EnvelopeCryptoService after = new EnvelopeCryptoService(rotated);

        assertEquals("k2", after.activeKeyId());
        assertEquals("kept", new String(after.decrypt(value, "secret-content"), StandardCharsets.UTF_8));
        assertEquals("k2", after.encrypt(new byte[]{1}, "secret-content").getKeyId());
    }

    @Test
    void unknownMasterKeyIsAnError() {
        EnvelopeCryptoService one = new EnvelopeCryptoService(properties("k1", KEY_ONE));
        EnvelopeCryptoService two = new EnvelopeCryptoService(properties("k2", KEY_TWO));
        EncryptedValue value = one.encrypt(new byte[]{9}, "secret-content");

        assertThrows(CryptoException.class, () -> two.decrypt(value, "secret-content"));
    }

    @Test
    void ephemeralKeyIsGeneratedWhenNoneConfigured() {
        EnvelopeCryptoService crypto = new EnvelopeCryptoService(new CryptoProperties());
        EncryptedValue value = crypto.encrypt(new byte[]{5, 6}, "voiceprint");

        assertArrayEquals(new byte[]{5, 6}, crypto.decrypt(value, "voiceprint"));
    }

    @Test
    void malformedMasterKeyFailsAtStartup() {
        assertThrows(IllegalStateException.class,
            () -> new EnvelopeCryptoService(properties("k1", "not base64 !!")));
        assertThrows(IllegalStateException.class,
            () -> new EnvelopeCryptoService(properties("k1", Base64.getEncoder().encodeToString(new byte[16]))));
    }
}
