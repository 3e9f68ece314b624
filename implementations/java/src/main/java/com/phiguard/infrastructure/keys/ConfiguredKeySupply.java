package com.phiguard.infrastructure.keys;

import com.phiguard.config.PhiGuardProperties;
import com.phiguard.domain.model.EncryptedValue;
import com.phiguard.infrastructure.crypto.KeyConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Base64;
import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Key supply backed by {@code phiguard.encryption.keys.<label>} (base64 values).
 *
 * <p>In production the property values come from the environment or a mounted secret, never
 * from a committed file.
 */
@Slf4j
public class ConfiguredKeySupply implements KeySupply {

    public static final Comparator<String> BY_VERSION_NUMBER =
        Comparator.comparingInt(EncryptedValue::versionNumber);

    private final Map<String, String> encodedKeys;

    public ConfiguredKeySupply(PhiGuardProperties properties) {
        this(properties.getEncryption().getKeys());
    }

    public ConfiguredKeySupply(Map<String, String> encodedKeys) {
        for (String label : encodedKeys.keySet()) {
            if (!EncryptedValue.isValidLabel(label)) {
                throw new KeyConfigurationException("Configured key label must match v<digits>: " + label);
            }
        }
        this.encodedKeys = Map.copyOf(encodedKeys);
        log.info("Configured key supply holds versions {}", listVersions());
    }

    @Override
    public Optional<byte[]> getKey(String label) {
        String encoded = encodedKeys.get(label);
        if (encoded == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Base64.getDecoder().decode(encoded.trim()));
        } catch (IllegalArgumentException e) {
            throw new KeyConfigurationException("Key " + label + " is not valid base64", label, e);
        }
    }

    @Override
    public SortedSet<String> listVersions() {
        TreeSet<String> labels = new TreeSet<>(BY_VERSION_NUMBER);
        labels.addAll(encodedKeys.keySet());
        return Collections.unmodifiableSortedSet(labels);
    }
}
