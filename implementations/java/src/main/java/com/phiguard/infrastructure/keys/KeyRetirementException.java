package com.phiguard.infrastructure.keys;

/**
 * A key version cannot be retired yet.
 */
public class KeyRetirementException extends RuntimeException {

    private final String keyVersion;

    public KeyRetirementException(String keyVersion, String reason) {
        super("Key " + keyVersion + " cannot be retired: " + reason);
        this.keyVersion = keyVersion;
    }

    public String getKeyVersion() {
        return keyVersion;
    }
}
