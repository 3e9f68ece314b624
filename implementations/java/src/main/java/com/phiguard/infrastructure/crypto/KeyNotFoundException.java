package com.phiguard.infrastructure.crypto;

/**
 * Registry lookup by label found nothing usable.
 */
public class KeyNotFoundException extends CryptoException {

    public KeyNotFoundException(String keyVersion, String reason) {
        super("Key " + keyVersion + " not available: " + reason, keyVersion, null);
    }
}
