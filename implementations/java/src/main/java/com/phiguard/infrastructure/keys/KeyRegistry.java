package com.phiguard.infrastructure.keys;

import com.phiguard.domain.model.EncryptedValue;
import com.phiguard.domain.model.KeyRole;
import com.phiguard.domain.model.KeyVersion;
import com.phiguard.infrastructure.crypto.KeyConfigurationException;
import com.phiguard.infrastructure.crypto.KeyLookup;
import com.phiguard.infrastructure.crypto.KeyNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Key Registry.
 *
 * <p>Holds every known key version and its role. Readers work on an immutable snapshot held in
 * an {@link AtomicReference}, so a lookup never blocks and never sees a half-applied change.
 * Mutations are serialized and publish a new snapshot in one swap.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>At most one WRITE_CURRENT version (exactly one once loading finished)</li>
 *   <li>Roles only move forward, except {@link #reinstate(String)} used by rollback</li>
 *   <li>RETIRED versions keep their label but no key material</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Slf4j
public class KeyRegistry {

    private final KeyStrengthValidator validator;
    private final RetirementGuard retirementGuard;
    private final Clock clock;

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    public KeyRegistry(KeyStrengthValidator validator, RetirementGuard retirementGuard, Clock clock) {
        this.validator = Objects.requireNonNull(validator);
        this.retirementGuard = Objects.requireNonNull(retirementGuard);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Current write key.
     *
     * @throws KeyNotFoundException if no version has been promoted yet
     */
    public WriteKey resolveForEncrypt() {
        Snapshot current = snapshot.get();
        if (current.writeLabel == null) {
            throw new KeyNotFoundException("(none)", "no write-current key version");
        }
        KeyVersion key = current.versions.get(current.writeLabel);
        return new WriteKey(key.getLabel(), key.getKeyBytes());
    }

    /**
     * Key bytes for decrypting values tagged with {@code label}.
     *
     * @throws KeyNotFoundException if the label is unknown or retired
     */
    public byte[] resolveForDecrypt(String label) {
        KeyVersion key = snapshot.get().versions.get(label);
        if (key == null) {
            throw new KeyNotFoundException(label, "not registered");
        }
        if (!key.isUsableForDecrypt()) {
            throw new KeyNotFoundException(label, "retired");
        }
        return key.getKeyBytes();
    }

    /**
     * Decrypt-side view for the cipher codec. Absent and retired labels resolve to empty.
     */
    public KeyLookup lookup() {
        return label -> Optional.ofNullable(snapshot.get().versions.get(label))
            .filter(KeyVersion::isUsableForDecrypt)
            .map(KeyVersion::getKeyBytes);
    }

    /**
     * Adds a version as READ_ONLY after validating its strength.
     *
     * <p>Registering the same bytes again under the same label is a no-op.
     *
     * @throws KeyConfigurationException if the key is weak, the label is retired, or the label
     *         is already registered with different material
     */
    public synchronized KeyVersion register(String label, byte[] keyBytes) {
        if (!EncryptedValue.isValidLabel(label)) {
            throw new KeyConfigurationException("Key version label must match v<digits>: " + label);
        }
        validator.validate(label, keyBytes);

        Snapshot current = snapshot.get();
        KeyVersion existing = current.versions.get(label);
        if (existing != null) {
            if (existing.getRole() == KeyRole.RETIRED) {
                throw new KeyConfigurationException("Key " + label + " is retired and cannot be reused", label, null);
            }
            if (!Arrays.equals(existing.getKeyBytes(), keyBytes)) {
                throw new KeyConfigurationException(
                    "Key " + label + " is already registered with different material", label, null);
            }
            return existing;
        }

        KeyVersion added = new KeyVersion(label, keyBytes, KeyRole.READ_ONLY, clock.instant());
        snapshot.set(current.with(added));
        log.info("Registered key version {}", label);
        return added;
    }

    /**
     * Promotes a newer version to WRITE_CURRENT; the previous write key becomes READ_ONLY.
     *
     * @throws KeyNotFoundException if the label is unknown or retired
     * @throws IllegalStateException if the label is not newer than the current write key
     */
    public synchronized void setCurrentWrite(String label) {
        Snapshot current = snapshot.get();
        KeyVersion target = requireUsable(current, label);
        if (label.equals(current.writeLabel)) {
            return;
        }
        if (current.writeLabel != null
                && target.getNumber() <= current.versions.get(current.writeLabel).getNumber()) {
            throw new IllegalStateException(
                "Key " + label + " is not newer than write-current " + current.writeLabel);
        }
        swapWriteKey(current, target);
        log.info("Key {} is now write-current", label);
    }

    /**
     * Makes a READ_ONLY version write-current again. Only rotation rollback calls this.
     *
     * @throws KeyNotFoundException if the label is unknown or retired
     */
    public synchronized void reinstate(String label) {
        Snapshot current = snapshot.get();
        KeyVersion target = requireUsable(current, label);
        if (label.equals(current.writeLabel)) {
            return;
        }
        swapWriteKey(current, target);
        log.warn("Key {} reinstated as write-current", label);
    }

    /**
     * Retires a READ_ONLY version and drops its key material.
     *
     * @throws KeyNotFoundException if the label is unknown
     * @throws KeyRetirementException if the version is write-current or still referenced
     */
    public synchronized void retire(String label) {
        Snapshot current = snapshot.get();
        KeyVersion key = current.versions.get(label);
        if (key == null) {
            throw new KeyNotFoundException(label, "not registered");
        }
        if (key.getRole() == KeyRole.RETIRED) {
            return;
        }
        if (key.getRole() == KeyRole.WRITE_CURRENT) {
            throw new KeyRetirementException(label, "it is the write-current key");
        }
        Optional<String> blocked = retirementGuard.blockingReason(label);
        if (blocked.isPresent()) {
            throw new KeyRetirementException(label, blocked.get());
        }

        snapshot.set(current.with(key.withRole(KeyRole.RETIRED, clock.instant())));
        log.info("Retired key version {}", label);
    }

    /**
     * Records a version retired in an earlier run. No key material is kept, so the label
     * can neither decrypt nor be registered again.
     *
     * @throws KeyConfigurationException if the label is the write-current key
     */
    public synchronized KeyVersion registerRetired(String label) {
        if (!EncryptedValue.isValidLabel(label)) {
            throw new KeyConfigurationException("Key version label must match v<digits>: " + label);
        }
        Snapshot current = snapshot.get();
        if (label.equals(current.writeLabel)) {
            throw new KeyConfigurationException("Key " + label + " is write-current and cannot be retired", label, null);
        }
        KeyVersion existing = current.versions.get(label);
        if (existing != null && existing.getRole() == KeyRole.RETIRED) {
            return existing;
        }
        KeyVersion retired = new KeyVersion(label, null, KeyRole.RETIRED, clock.instant());
        snapshot.set(current.with(retired));
        log.info("Key version {} loaded as retired", label);
        return retired;
    }

    public String currentWriteLabel() {
        return snapshot.get().writeLabel;
    }

    public Optional<KeyVersion> find(String label) {
        return Optional.ofNullable(snapshot.get().versions.get(label));
    }

    /**
     * All versions in ascending order. Key bytes stay inside the returned objects.
     */
    public List<KeyVersion> snapshot() {
        List<KeyVersion> versions = new ArrayList<>(snapshot.get().versions.values());
        versions.sort(Comparator.comparingInt(KeyVersion::getNumber));
        return Collections.unmodifiableList(versions);
    }

    /**
     * Label following the highest version ever registered, retired ones included.
     */
    public String nextVersionLabel() {
        int highest = snapshot.get().versions.values().stream()
            .mapToInt(KeyVersion::getNumber)
            .max()
            .orElse(0);
        return "v" + (highest + 1);
    }

    /**
     * True when the write-current key was activated longer than {@code maxAge} ago.
     */
    public boolean isRotationDue(Duration maxAge) {
        Snapshot current = snapshot.get();
        if (current.writeLabel == null) {
            return false;
        }
        return current.versions.get(current.writeLabel).isOlderThan(maxAge, clock.instant());
    }

    private void swapWriteKey(Snapshot current, KeyVersion target) {
        Snapshot next = current;
        if (current.writeLabel != null) {
            KeyVersion previous = current.versions.get(current.writeLabel);
            next = next.with(previous.withRole(KeyRole.READ_ONLY, clock.instant()));
        }
        next = next.with(target.withRole(KeyRole.WRITE_CURRENT, clock.instant())).withWriteLabel(target.getLabel());
        snapshot.set(next);
    }

    private static KeyVersion requireUsable(Snapshot current, String label) {
        KeyVersion key = current.versions.get(label);
        if (key == null) {
            throw new KeyNotFoundException(label, "not registered");
        }
        if (!key.isUsableForDecrypt()) {
            throw new KeyNotFoundException(label, "retired");
        }
        return key;
    }

    /**
     * Label and bytes of the write-current key.
     */
    public record WriteKey(String label, byte[] keyBytes) {

        @Override
        public String toString() {
            return "WriteKey[label=" + label + "]";
        }
    }

    private static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(Map.of(), null);

        final Map<String, KeyVersion> versions;
        final String writeLabel;

        Snapshot(Map<String, KeyVersion> versions, String writeLabel) {
            this.versions = versions;
            this.writeLabel = writeLabel;
        }

        Snapshot with(KeyVersion version) {
            Map<String, KeyVersion> copy = new LinkedHashMap<>(versions);
            copy.put(version.getLabel(), version);
            return new Snapshot(Collections.unmodifiableMap(copy), writeLabel);
        }

        Snapshot withWriteLabel(String label) {
            return new Snapshot(versions, label);
        }
    }
}
