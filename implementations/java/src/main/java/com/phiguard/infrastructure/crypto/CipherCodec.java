package com.phiguard.infrastructure.crypto;

import com.phiguard.domain.model.EncryptedValue;

/**
 * Authenticated encryption and the ciphertext wire format.
 *
 * <p>Implementations never log plaintext or key bytes, only version labels and outcomes.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface CipherCodec {

    /**
     * Encrypt under a fresh random nonce.
     *
     * @param label version label to embed
     * @param keyBytes 32-byte AES key
     * @param plaintext data to encrypt
     * @return encrypted value tagged with {@code label}
     */
    EncryptedValue encrypt(String label, byte[] keyBytes, byte[] plaintext);

    /**
     * Parse, resolve the embedded version through {@code keys}, verify and decrypt.
     *
     * @param keys key lookup by version label
     * @param serialized stored wire-format value
     * @return plaintext bytes
     * @throws IntegrityException if the tag does not verify or the envelope is malformed
     * @throws UnknownKeyVersionException if {@code keys} has no key for the embedded label
     */
    byte[] decrypt(KeyLookup keys, String serialized);
}
