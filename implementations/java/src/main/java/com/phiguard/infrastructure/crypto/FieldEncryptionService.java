package com.phiguard.infrastructure.crypto;

import com.phiguard.domain.model.EncryptedValue;
import com.phiguard.infrastructure.keys.KeyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * Field Adapter.
 *
 * <p>Sits between application code and storage: encrypts with the registry's write-current
 * key before a write and decrypts with the version embedded in the value after a read.
 * The current write pointer is never consulted on the read path.
 *
 * <p>Any read failure surfaces as {@link DecryptionFailedException}. A failed decrypt never
 * becomes a null or empty string.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FieldEncryptionService {

    private final CipherCodec cipherCodec;
    private final KeyRegistry keyRegistry;

    /**
     * Encrypts under the current write key.
     *
     * @return serialized value, or null for null input
     */
    public String encryptOnWrite(String plaintext) {
        if (plaintext == null) {
            return null;
        }
        KeyRegistry.WriteKey writeKey = keyRegistry.resolveForEncrypt();
        return cipherCodec.encrypt(writeKey.label(), writeKey.keyBytes(), utf8(plaintext)).serialize();
    }

    /**
     * Encrypts under a specific registered version (rotation target).
     *
     * @throws KeyNotFoundException if the version is unknown or retired
     */
    public String encryptUnder(String label, String plaintext) {
        if (plaintext == null) {
            return null;
        }
        byte[] keyBytes = keyRegistry.resolveForDecrypt(label);
        return cipherCodec.encrypt(label, keyBytes, utf8(plaintext)).serialize();
    }

    /**
     * Decrypts with the key named inside the value.
     *
     * @return plaintext, or null for null input
     * @throws DecryptionFailedException if the value is malformed, tampered with, or names a
     *         key that is not available
     */
    public String decryptOnRead(String serialized) {
        if (serialized == null) {
            return null;
        }
        try {
            byte[] plaintext = cipherCodec.decrypt(keyRegistry.lookup(), serialized);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (CryptoException e) {
            log.warn("Field decryption failed ({}) for key {}", e.getClass().getSimpleName(), e.getKeyVersion());
            throw new DecryptionFailedException("Failed to decrypt field", e.getKeyVersion(), e);
        }
    }

    /**
     * Version label of a stored value, without decrypting it.
     *
     * @throws DecryptionFailedException if the value is malformed
     */
    public String versionOf(String serialized) {
        try {
            return EncryptedValue.versionOf(serialized);
        } catch (EncryptedValue.MalformedEncryptedValueException e) {
            throw new DecryptionFailedException("Stored value is not a valid encrypted value", null, e);
        }
    }

    private static byte[] utf8(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8);
    }
}
