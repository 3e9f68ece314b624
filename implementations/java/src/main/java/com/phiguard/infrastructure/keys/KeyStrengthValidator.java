package com.phiguard.infrastructure.keys;

import com.phiguard.config.PhiGuardProperties;
import com.phiguard.domain.model.KeyVersion;
import com.phiguard.infrastructure.crypto.KeyConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Base64;

/**
 * Rejects key material that is malformed or obviously weak.
 *
 * <p>Checks, in order:
 * <ul>
 *   <li>Exactly 32 bytes (AES-256)</li>
 *   <li>Not all zeros, not a single repeated byte</li>
 *   <li>Not a sequential or reverse sequential run</li>
 *   <li>Enough distinct byte values</li>
 *   <li>Shannon entropy above the configured floor</li>
 *   <li>No byte value repeated more than the configured maximum</li>
 * </ul>
 *
 * <p>Error messages name the label and the failed check, never the key.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Component
@Slf4j
public class KeyStrengthValidator {

    private final double minDistinctByteRatio;
    private final double minShannonEntropy;
    private final int maxByteOccurrences;

    @Autowired
    public KeyStrengthValidator(PhiGuardProperties properties) {
        this(properties.getEncryption().getMinDistinctByteRatio(),
            properties.getEncryption().getMinShannonEntropy(),
            properties.getEncryption().getMaxByteOccurrences());
    }

    public KeyStrengthValidator(double minDistinctByteRatio, double minShannonEntropy, int maxByteOccurrences) {
        this.minDistinctByteRatio = minDistinctByteRatio;
        this.minShannonEntropy = minShannonEntropy;
        this.maxByteOccurrences = maxByteOccurrences;
    }

    public static KeyStrengthValidator withDefaults() {
        return new KeyStrengthValidator(new PhiGuardProperties());
    }

    /**
     * Decodes a base64 key string and validates the result.
     *
     * @throws KeyConfigurationException if the string is not base64 or the key is weak
     */
    public byte[] decode(String label, String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new KeyConfigurationException("Key " + label + " is empty", label, null);
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new KeyConfigurationException("Key " + label + " is not valid base64", label, e);
        }
        validate(label, keyBytes);
        return keyBytes;
    }

    /**
     * @throws KeyConfigurationException naming the first failed check
     */
    public void validate(String label, byte[] keyBytes) {
        if (keyBytes == null || keyBytes.length != KeyVersion.KEY_LENGTH) {
            reject(label, "must be exactly 32 bytes, got " + (keyBytes == null ? 0 : keyBytes.length));
        }

        int[] counts = new int[256];
        for (byte b : keyBytes) {
            counts[b & 0xFF]++;
        }

        if (counts[0] == keyBytes.length) {
            reject(label, "is all zeros");
        }

        int distinct = 0;
        int maxCount = 0;
        for (int count : counts) {
            if (count > 0) {
                distinct++;
                maxCount = Math.max(maxCount, count);
            }
        }

        if (distinct == 1) {
            reject(label, "is a single repeated byte");
        }
        if (isRun(keyBytes, 1)) {
            reject(label, "is a sequential byte pattern");
        }
        if (isRun(keyBytes, -1)) {
            reject(label, "is a reverse sequential byte pattern");
        }

        int minDistinct = (int) Math.ceil(minDistinctByteRatio * keyBytes.length);
        if (distinct < minDistinct) {
            reject(label, "has only " + distinct + " distinct bytes (minimum " + minDistinct + ")");
        }

        double entropy = shannonEntropy(counts, keyBytes.length);
        if (entropy < minShannonEntropy) {
            reject(label, String.format("has low entropy (%.2f bits/byte, minimum %.2f)", entropy, minShannonEntropy));
        }

        if (maxCount > maxByteOccurrences) {
            reject(label, "repeats a byte " + maxCount + " times (maximum " + maxByteOccurrences + ")");
        }

        log.debug("Key {} passed strength validation", label);
    }

    private static boolean isRun(byte[] keyBytes, int step) {
        for (int i = 1; i < keyBytes.length; i++) {
            if ((keyBytes[i] & 0xFF) != ((keyBytes[i - 1] & 0xFF) + step + 256) % 256) {
                return false;
            }
        }
        return true;
    }

    static double shannonEntropy(int[] counts, int length) {
        double entropy = 0.0;
        for (int count : counts) {
            if (count > 0) {
                double p = (double) count / length;
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        return entropy;
    }

    private static void reject(String label, String reason) {
        throw new KeyConfigurationException("Key " + label + " " + reason, label, null);
    }
}
