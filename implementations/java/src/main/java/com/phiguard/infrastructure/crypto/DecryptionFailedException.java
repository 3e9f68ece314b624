package com.phiguard.infrastructure.crypto;

/**
 * A field could not be decrypted on read.
 *
 * <p>Callers must surface this as a hard failure. It is never converted into a null or
 * empty value because that would hide corruption or tampering of PHI.
 */
public class DecryptionFailedException extends CryptoException {

    public DecryptionFailedException(String message, String keyVersion, Throwable cause) {
        super(message, keyVersion, cause);
    }
}
