package com.phiguard.infrastructure.crypto;

/**
 * Base exception for cryptographic failures.
 *
 * <p>Messages carry key version labels and field identifiers only, never plaintext,
 * ciphertext or key material.
 */
public class CryptoException extends RuntimeException {

    private final String keyVersion;

    public CryptoException(String message) {
        this(message, null, null);
    }

    public CryptoException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public CryptoException(String message, String keyVersion, Throwable cause) {
        super(message, cause);
        this.keyVersion = keyVersion;
    }

    /**
     * Version label involved, if known.
     */
    public String getKeyVersion() {
        return keyVersion;
    }
}
