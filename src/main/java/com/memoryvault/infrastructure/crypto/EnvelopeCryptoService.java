package com.memoryvault.infrastructure.crypto;

import com.memoryvault.config.CryptoProperties;
import com.memoryvault.domain.model.EncryptedValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Envelope encryption with a locally held master key.
 *
 * Architecture:
 * - Master key (KEK) loaded from configuration, never serialized
 * - Data Encryption Key (DEK) generated for each encrypt operation
 * - DEK wrapped by the KEK with AES-256-GCM and stored with the ciphertext
 * - AES-256-GCM for data encryption, purpose bound as associated data
 *
 * Previous master keys stay usable for decryption, so rotating
 * {@code memoryvault.crypto.master-key-id} does not orphan stored values.
 */
@Service
@Slf4j
public class EnvelopeCryptoService implements CryptoService {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 128;
    private static final int AES_KEY_SIZE = 256;
    private static final int AES_KEY_BYTES = AES_KEY_SIZE / 8;

    private final SecureRandom secureRandom = new SecureRandom();

    private final String activeKeyId;

    private final Map<String, SecretKey> masterKeys;

    public EnvelopeCryptoService(CryptoProperties properties) {
        this.activeKeyId = properties.getMasterKeyId();
        this.masterKeys = loadMasterKeys(properties);
        log.info("Envelope encryption ready with master key {} ({} key(s) loaded)",
            activeKeyId, masterKeys.size());
    }

    @Override
    public EncryptedValue encrypt(byte[] plaintext, String purpose) {
        try {
            SecretKey dek = generateDek();

            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, dek, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
            cipher.updateAAD(purpose.getBytes(StandardCharsets.UTF_8));

            // GCM produces ciphertext || auth_tag
            byte[] ciphertextWithTag = cipher.doFinal(plaintext);

            int ciphertextLength = ciphertextWithTag.length - (GCM_TAG_LENGTH / 8);
            byte[] ciphertext = Arrays.copyOfRange(ciphertextWithTag, 0, ciphertextLength);
            byte[] authTag = Arrays.copyOfRange(ciphertextWithTag, ciphertextLength, ciphertextWithTag.length);

            byte[] wrappedKey = wrapDek(dek, activeKeyId);

            if (log.isDebugEnabled()) {
                log.debug("Encrypted {} bytes for purpose {} under master key {}",
                    plaintext.length, purpose, activeKeyId);
            }

            return EncryptedValue.builder()
                .ciphertext(ciphertext)
                .wrappedKey(wrappedKey)
                .keyId(activeKeyId)
                .algorithm(EncryptedValue.AES_256_GCM)
                .iv(iv)
                .authTag(authTag)
                .build();

        } catch (GeneralSecurityException e) {
            log.error("Encryption failed for purpose {}", purpose, e);
            throw new CryptoException("Failed to encrypt data", e);
        }
    }

    @Override
    public byte[] decrypt(EncryptedValue encryptedValue, String purpose) {
        try {
            SecretKey dek = unwrapDek(encryptedValue.getWrappedKey(), encryptedValue.getKeyId());

            byte[] ciphertextWithTag = ByteBuffer.allocate(
                encryptedValue.getCiphertext().length + encryptedValue.getAuthTag().length
            )
            .put(encryptedValue.getCiphertext())
            .put(encryptedValue.getAuthTag())
            .array();

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, dek, new GCMParameterSpec(GCM_TAG_LENGTH, encryptedValue.getIv()));
            cipher.updateAAD(purpose.getBytes(StandardCharsets.UTF_8));

            byte[] plaintext = cipher.doFinal(ciphertextWithTag);

            if (log.isDebugEnabled()) {
                log.debug("Decrypted {} bytes for purpose {} under master key {}",
                    plaintext.length, purpose, encryptedValue.getKeyId());
            }
            return plaintext;

        } catch (GeneralSecurityException e) {
            log.error("Decryption failed for master key {} and purpose {}", encryptedValue.getKeyId(), purpose, e);
            throw new CryptoException("Failed to decrypt data", e);
        }
    }

    @Override
    public String activeKeyId() {
        return activeKeyId;
    }

    private SecretKey generateDek() throws GeneralSecurityException {
        KeyGenerator keyGen = KeyGenerator.getInstance("AES");
        keyGen.init(AES_KEY_SIZE, secureRandom);
        return keyGen.generateKey();
    }

    /**
     * Wraps the DEK as {@code wrapIv || AES-GCM(kek, dek)}, binding the key id
     * as associated data.
     */
    private byte[] wrapDek(SecretKey dek, String keyId) throws GeneralSecurityException {
        byte[] wrapIv = new byte[GCM_IV_LENGTH];
        secureRandom.nextBytes(wrapIv);

        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, masterKey(keyId), new GCMParameterSpec(GCM_TAG_LENGTH, wrapIv));
        cipher.updateAAD(keyId.getBytes(StandardCharsets.UTF_8));
        byte[] wrapped = cipher.doFinal(dek.getEncoded());

        return ByteBuffer.allocate(wrapIv.length + wrapped.length)
            .put(wrapIv)
            .put(wrapped)
            .array();
    }

    private SecretKey unwrapDek(byte[] wrappedKey, String keyId) throws GeneralSecurityException {
        if (wrappedKey.length <= GCM_IV_LENGTH) {
            throw new CryptoException("Wrapped key is truncated");
        }
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(Cipher.DECRYPT_MODE, masterKey(keyId),
            new GCMParameterSpec(GCM_TAG_LENGTH, wrappedKey, 0, GCM_IV_LENGTH));
        cipher.updateAAD(keyId.getBytes(StandardCharsets.UTF_8));
        byte[] dek = cipher.doFinal(wrappedKey, GCM_IV_LENGTH, wrappedKey.length - GCM_IV_LENGTH);
        return new SecretKeySpec(dek, "AES");
    }

    private SecretKey masterKey(String keyId) {
        SecretKey key = masterKeys.get(keyId);
        if (key == null) {
            throw new CryptoException("Unknown master key: " + keyId);
        }
        return key;
    }

    private Map<String, SecretKey> loadMasterKeys(CryptoProperties properties) {
        Map<String, SecretKey> keys = new HashMap<>();
        properties.getRetiredKeys().forEach((keyId, encoded) -> keys.put(keyId, decodeKey(keyId, encoded)));

        String encoded = properties.getMasterKey();
        if (encoded == null || encoded.isBlank()) {
            log.warn("No master key configured; generated an ephemeral key {}. "
                + "Values encrypted by this instance will not survive a restart.", activeKeyId);
            byte[] generated = new byte[AES_KEY_BYTES];
            secureRandom.nextBytes(generated);
            keys.put(activeKeyId, new SecretKeySpec(generated, "AES"));
        } else {
            keys.put(activeKeyId, decodeKey(activeKeyId, encoded));
        }
        return Map.copyOf(keys);
    }

    private static SecretKey decodeKey(String keyId, String encoded) {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Master key " + keyId + " is not valid Base64", e);
        }
        if (raw.length != AES_KEY_BYTES) {
            throw new IllegalStateException(
                "Master key " + keyId + " must be " + AES_KEY_BYTES + " bytes, was " + raw.length);
        }
        return new SecretKeySpec(raw, "AES");
    }
}
