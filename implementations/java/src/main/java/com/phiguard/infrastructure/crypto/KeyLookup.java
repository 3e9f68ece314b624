package com.phiguard.infrastructure.crypto;

import java.util.Optional;

/**
 * Resolves raw key bytes by version label for decryption.
 */
@FunctionalInterface
public interface KeyLookup {

    Optional<byte[]> find(String label);
}
