package com.phiguard.infrastructure.keys;

import java.util.Optional;
import java.util.SortedSet;

/**
 * Source of key material by version label (environment, secrets manager, HSM front end).
 *
 * <p>Opaque to the rest of the system: callers see labels and raw bytes only.
 */
public interface KeySupply {

    /**
     * Raw 32-byte key for {@code label}. Not validated here.
     *
     * @throws com.phiguard.infrastructure.crypto.KeyConfigurationException if the stored
     *         material cannot be decoded
     */
    Optional<byte[]> getKey(String label);

    /**
     * All labels the supply knows, in ascending version order.
     */
    SortedSet<String> listVersions();

    /**
     * Forgets any copy of {@code label} held by this supply. No-op unless the supply caches.
     */
    default void invalidate(String label) {
    }
}
