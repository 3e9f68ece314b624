package com.phiguard.infrastructure.crypto;

import com.phiguard.domain.model.EncryptedValue;
import com.phiguard.domain.model.KeyVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * AES-256-GCM codec.
 *
 * Security properties:
 * - Random 96-bit nonce per encryption from {@link SecureRandom}
 * - 128-bit authentication tag (integrity + confidentiality)
 * - Decryption key chosen by the version embedded in the value, never a global pointer
 * - Malformed envelopes are reported as integrity failures
 */
@Service
@Slf4j
public class AesGcmCipherCodec implements CipherCodec {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH = 128; // bits

    private final SecureRandom secureRandom;

    public AesGcmCipherCodec() {
        this(new SecureRandom());
    }

    public AesGcmCipherCodec(SecureRandom secureRandom) {
        this.secureRandom = Objects.requireNonNull(secureRandom, "SecureRandom must not be null");
    }

    @Override
    public EncryptedValue encrypt(String label, byte[] keyBytes, byte[] plaintext) {
        Objects.requireNonNull(plaintext, "Plaintext must not be null");
        requireKeyLength(label, keyBytes);

        byte[] nonce = new byte[EncryptedValue.NONCE_LENGTH];
        secureRandom.nextBytes(nonce);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(keyBytes, "AES"),
                new GCMParameterSpec(GCM_TAG_LENGTH, nonce));

            // GCM produces ciphertext || auth_tag
            byte[] ciphertextWithTag = cipher.doFinal(plaintext);

            log.debug("Encrypted field with key {}", label);
            return new EncryptedValue(label, nonce, ciphertextWithTag);

        } catch (GeneralSecurityException e) {
            log.error("Encryption failed with key {}", label);
            throw new CryptoException("Failed to encrypt data", label, e);
        }
    }

    @Override
    public byte[] decrypt(KeyLookup keys, String serialized) {
        EncryptedValue value;
        try {
            value = EncryptedValue.parse(serialized);
        } catch (EncryptedValue.MalformedEncryptedValueException e) {
            log.warn("Rejected malformed encrypted value: {}", e.getMessage());
            throw new IntegrityException("Encrypted value is malformed", null, e);
        }

        String label = value.getVersion();
        byte[] keyBytes = keys.find(label).orElseThrow(() -> {
            log.warn("Decryption refused: key {} is not registered", label);
            return new UnknownKeyVersionException(label);
        });
        requireKeyLength(label, keyBytes);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(keyBytes, "AES"),
                new GCMParameterSpec(GCM_TAG_LENGTH, value.getNonce()));

            byte[] plaintext = cipher.doFinal(value.getCiphertextWithTag());

            log.debug("Decrypted field with key {}", label);
            return plaintext;

        } catch (AEADBadTagException e) {
            log.warn("Integrity check failed for value under key {}", label);
            throw new IntegrityException("Authentication tag mismatch", label, e);
        } catch (GeneralSecurityException e) {
            log.error("Decryption failed with key {}", label);
            throw new CryptoException("Failed to decrypt data", label, e);
        }
    }

    private static void requireKeyLength(String label, byte[] keyBytes) {
        if (keyBytes == null || keyBytes.length != KeyVersion.KEY_LENGTH) {
            throw new KeyConfigurationException("Key " + label + " must be 32 bytes", label, null);
        }
    }
}
