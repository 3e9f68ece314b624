package com.phiguard.domain.model;

/**
 * Role of a key version in the registry.
 *
 * <pre>
 * WRITE_CURRENT → READ_ONLY → RETIRED
 * </pre>
 *
 * <p>Exactly one key is {@link #WRITE_CURRENT} at any time. New versions are registered
 * READ_ONLY and promoted; reinstating a READ_ONLY key on rollback is the only other way back.
 */
public enum KeyRole {

    /**
     * Used for every new encryption; also decrypts.
     */
    WRITE_CURRENT,

    /**
     * Decrypts existing values only.
     */
    READ_ONLY,

    /**
     * No values remain under this key; key material has been wiped.
     */
    RETIRED
}
