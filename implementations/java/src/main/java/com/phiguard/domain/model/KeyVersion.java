package com.phiguard.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A registered key version.
 *
 * <p>Immutable: role changes produce a new instance so the registry can swap its whole
 * snapshot atomically. Key bytes are never part of {@link #toString()}.
 *
 * @author Security Team
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode(exclude = "keyBytes")
public final class KeyVersion {

    public static final int KEY_LENGTH = 32;

    private final String label;
    private final byte[] keyBytes;
    private final KeyRole role;
    private final Instant activatedAt;

    public KeyVersion(String label, byte[] keyBytes, KeyRole role, Instant activatedAt) {
        if (!EncryptedValue.isValidLabel(label)) {
            throw new IllegalArgumentException("Key version label must match v<digits>: " + label);
        }
        this.label = label;
        this.role = Objects.requireNonNull(role, "Role must not be null");
        this.activatedAt = Objects.requireNonNull(activatedAt, "Activation time must not be null");

        if (role == KeyRole.RETIRED) {
            this.keyBytes = new byte[0];
        } else {
            Objects.requireNonNull(keyBytes, "Key bytes must not be null");
            if (keyBytes.length != KEY_LENGTH) {
                throw new IllegalArgumentException("Key must be 32 bytes");
            }
            this.keyBytes = keyBytes.clone();
        }
    }

    public byte[] getKeyBytes() {
        return keyBytes.clone();
    }

    public int getNumber() {
        return EncryptedValue.versionNumber(label);
    }

    public boolean isUsableForDecrypt() {
        return role != KeyRole.RETIRED;
    }

    /**
     * Copy with a new role. Moving to RETIRED drops the key material.
     */
    public KeyVersion withRole(KeyRole next, Instant at) {
        Instant activation = next == KeyRole.WRITE_CURRENT ? at : activatedAt;
        return new KeyVersion(label, keyBytes, next, activation);
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return activatedAt.plus(maxAge).isBefore(now);
    }

    @Override
    public String toString() {
        return "KeyVersion[label=" + label + ", role=" + role + ", activatedAt=" + activatedAt + "]";
    }
}
