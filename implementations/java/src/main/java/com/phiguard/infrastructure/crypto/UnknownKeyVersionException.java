package com.phiguard.infrastructure.crypto;

/**
 * The ciphertext names a key version that is not registered (or has been retired).
 */
public class UnknownKeyVersionException extends CryptoException {

    public UnknownKeyVersionException(String keyVersion) {
        super("No key registered for version " + keyVersion, keyVersion, null);
    }
}
