package com.memoryvault.application.exceptions;

import java.util.UUID;

/**
 * Stored ciphertext could not be decrypted after access was granted.
 *
 * <p>An integrity fault (corrupt data or a missing master key), never a
 * policy decision, so it is raised rather than folded into a denial.
 */
public class DecryptionFailedException extends RuntimeException {

    private final UUID recordId;

    public DecryptionFailedException(UUID recordId, Throwable cause) {
        super("Stored content of record " + recordId + " could not be decrypted", cause);
        this.recordId = recordId;
    }

    public UUID getRecordId() {
        return recordId;
    }
}
