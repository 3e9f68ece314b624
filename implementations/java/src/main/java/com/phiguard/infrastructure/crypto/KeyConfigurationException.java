package com.phiguard.infrastructure.crypto;

/**
 * Malformed or weak key material. Fatal at startup.
 */
public class KeyConfigurationException extends CryptoException {

    public KeyConfigurationException(String message) {
        super(message);
    }

    public KeyConfigurationException(String message, String keyVersion, Throwable cause) {
        super(message, keyVersion, cause);
    }
}
