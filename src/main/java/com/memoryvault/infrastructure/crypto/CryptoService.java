package com.memoryvault.infrastructure.crypto;

import com.memoryvault.domain.model.EncryptedValue;

/**
 * Cryptographic service interface.
 *
 * <p>Implementations own the master key; callers only ever see
 * self-describing {@link EncryptedValue}s.
 *
 * @since 1.0.0
 */
public interface CryptoService {

    /**
     * Encrypt data using envelope encryption.
     *
     * @param plaintext Data to encrypt
     * @param purpose Associated data binding the ciphertext to its use
     *                (e.g. "secret-content", "voiceprint")
     * @return Encrypted value carrying its wrapped data key
     */
    EncryptedValue encrypt(byte[] plaintext, String purpose);

    /**
     * Decrypt data.
     *
     * @param encryptedValue Encrypted value
     * @param purpose Same purpose passed to {@link #encrypt}
     * @return Decrypted plaintext bytes
     * @throws CryptoException on any integrity or key failure
     */
    byte[] decrypt(EncryptedValue encryptedValue, String purpose);

    /**
     * Identifier of the master key currently used for wrapping.
     */
    String activeKeyId();
}
