package com.memoryvault.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.util.Base64;
import java.util.Objects;

/**
 * Self-describing ciphertext produced by envelope encryption.
 *
 * <p>The content is encrypted with a per-value data key; the data key is
 * itself wrapped by the master key identified by {@link #getKeyId()} and
 * travels with the ciphertext. Nothing in this class holds plaintext or an
 * unwrapped key.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Immutable; every byte array is copied on the way in and out</li>
 *   <li>AES-256-GCM values carry a 12-byte IV and a 16-byte tag</li>
 *   <li>Key ids are restricted to {@code [a-zA-Z0-9_-]}</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class EncryptedValue implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String AES_256_GCM = "AES-256-GCM";

    private final byte[] ciphertext;

    /**
     * Data key wrapped by the master key: wrap IV followed by the wrapped
     * key bytes and their tag.
     */
    private final byte[] wrappedKey;

    /**
     * Identifier of the master key that wrapped {@link #wrappedKey}.
     */
    private final String keyId;

    private final String algorithm;

    private final byte[] iv;

    private final byte[] authTag;

    /**
     * @throws IllegalArgumentException if any part is missing or malformed
     */
    public EncryptedValue(
            byte[] ciphertext,
            byte[] wrappedKey,
            String keyId,
            String algorithm,
            byte[] iv,
            byte[] authTag) {

        Objects.requireNonNull(ciphertext, "Ciphertext must not be null");
        Objects.requireNonNull(wrappedKey, "Wrapped key must not be null");
        if (wrappedKey.length == 0) {
            throw new IllegalArgumentException("Wrapped key must not be empty");
        }

        this.ciphertext = ciphertext.clone();
        this.wrappedKey = wrappedKey.clone();
        this.keyId = validateKeyId(keyId);
        this.algorithm = validateAlgorithm(algorithm);
        this.iv = iv != null ? iv.clone() : null;
        this.authTag = authTag != null ? authTag.clone() : null;

        if (AES_256_GCM.equals(algorithm) && (iv == null || iv.length != 12)) {
            throw new IllegalArgumentException("AES-256-GCM requires 12-byte IV");
        }
        if (AES_256_GCM.equals(algorithm) && (authTag == null || authTag.length != 16)) {
            throw new IllegalArgumentException("AES-256-GCM requires 16-byte auth tag");
        }
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public byte[] getWrappedKey() {
        return wrappedKey.clone();
    }

    public byte[] getIv() {
        return iv != null ? iv.clone() : null;
    }

    public byte[] getAuthTag() {
        return authTag != null ? authTag.clone() : null;
    }

    private static String validateKeyId(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key ID must not be null or blank");
        }
        if (keyId.length() > 256) {
            throw new IllegalArgumentException("Key ID too long (max 256 characters)");
        }
        if (!keyId.matches("^[a-zA-Z0-9_-]+$")) {
            throw new IllegalArgumentException(
                "Invalid key ID format (must be alphanumeric with hyphens/underscores)"
            );
        }
        return keyId;
    }

    private static String validateAlgorithm(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            throw new IllegalArgumentException("Algorithm must not be null or blank");
        }
        if (!AES_256_GCM.equals(algorithm)) {
            throw new IllegalArgumentException("Unsupported algorithm (must be AES-256-GCM)");
        }
        return algorithm;
    }

    /**
     * Truncated, key-masked rendering safe for logs.
     */
    @Override
    public String toString() {
        String encoded = Base64.getEncoder().encodeToString(ciphertext);
        String truncated = encoded.length() > 16 ? encoded.substring(0, 16) + "..." : encoded;
        return String.format(
            "EncryptedValue[algorithm=%s, keyId=%s, ciphertext=%s]",
            algorithm,
            maskKeyId(keyId),
            truncated
        );
    }

    private static String maskKeyId(String keyId) {
        if (keyId.length() <= 4) {
            return "****";
        }
        return "****" + keyId.substring(keyId.length() - 4);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private byte[] ciphertext;
        private byte[] wrappedKey;
        private String keyId;
        private String algorithm = AES_256_GCM;
        private byte[] iv;
        private byte[] authTag;

        public Builder ciphertext(byte[] ciphertext) {
            this.ciphertext = ciphertext;
            return this;
        }

        public Builder wrappedKey(byte[] wrappedKey) {
            this.wrappedKey = wrappedKey;
            return this;
        }

        public Builder keyId(String keyId) {
            this.keyId = keyId;
            return this;
        }

        public Builder algorithm(String algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder iv(byte[] iv) {
            this.iv = iv;
            return this;
        }

        public Builder authTag(byte[] authTag) {
            this.authTag = authTag;
            return this;
        }

        public EncryptedValue build() {
            return new EncryptedValue(ciphertext, wrappedKey, keyId, algorithm, iv, authTag);
        }
    }
}
