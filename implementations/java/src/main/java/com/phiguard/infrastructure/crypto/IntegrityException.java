package com.phiguard.infrastructure.crypto;

/**
 * Authentication tag verification failed, or the stored envelope is malformed.
 *
 * <p>Treated as tampering or corruption: fatal to the read.
 */
public class IntegrityException extends CryptoException {

    public IntegrityException(String message, String keyVersion, Throwable cause) {
        super(message, keyVersion, cause);
    }
}
