package com.phiguard.infrastructure.keys;

import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.model.RotationStatus;
import com.phiguard.domain.repository.RetiredKeyRepository;
import com.phiguard.domain.repository.RotationJobRepository;
import com.phiguard.infrastructure.crypto.KeyConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Fills a fresh {@link KeyRegistry} from the key supply at startup.
 *
 * <p>Labels recorded as retired are loaded without key material even if the supply still
 * holds it. The write-current version is the target of an active rotation job when there is
 * one, otherwise the configured version, otherwise the outcome of the most recent rotation job
 * (its target, or its source if it was rolled back), otherwise the highest supplied version.
 * Any weak or undecodable key aborts startup, as does a configured version that contradicts
 * an active rotation.
 */
@Slf4j
@RequiredArgsConstructor
public class KeyRegistryLoader {

    private final KeySupply keySupply;
    private final RotationJobRepository jobRepository;
    private final RetiredKeyRepository retiredKeyRepository;

    public void load(KeyRegistry registry, String configuredCurrent) {
        SortedSet<String> labels = keySupply.listVersions();
        if (labels.isEmpty()) {
            throw new KeyConfigurationException("No encryption keys configured");
        }

        Set<String> retired = retiredKeyRepository.findAllLabels();
        SortedSet<String> usable = new TreeSet<>(ConfiguredKeySupply.BY_VERSION_NUMBER);
        for (String label : labels) {
            if (retired.contains(label)) {
                log.warn("Key supply still holds retired key {}, material ignored", label);
                continue;
            }
            byte[] keyBytes = keySupply.getKey(label)
                .orElseThrow(() -> new KeyConfigurationException("Key supply listed " + label + " but returned nothing", label, null));
            registry.register(label, keyBytes);
            usable.add(label);
        }
        retired.forEach(registry::registerRetired);

        if (usable.isEmpty()) {
            throw new KeyConfigurationException("Every supplied encryption key is retired");
        }

        String current = chooseCurrent(usable, configuredCurrent);
        if (retired.contains(current)) {
            throw new KeyConfigurationException("Write-current key " + current + " is retired", current, null);
        }
        if (!usable.contains(current)) {
            throw new KeyConfigurationException("Write-current key " + current + " is not in the key supply", current, null);
        }
        registry.setCurrentWrite(current);

        log.info("Key registry loaded: versions={}, retired={}, writeCurrent={}", usable, retired, current);
    }

    private String chooseCurrent(SortedSet<String> usable, String configuredCurrent) {
        boolean configured = configuredCurrent != null && !configuredCurrent.isBlank();

        List<RotationJob> active = jobRepository.findByStatusIn(RotationStatus.active());
        if (!active.isEmpty()) {
            RotationJob job = active.get(0);
            String target = job.getTargetVersion();
            if (configured && !configuredCurrent.trim().equals(target)) {
                throw new KeyConfigurationException(String.format(
                    "Configured write-current key %s contradicts rotation job %s (%s -> %s, %s); "
                        + "unset it or roll the job back", configuredCurrent.trim(), job.getId(),
                    job.getSourceVersion(), target, job.getStatus()), configuredCurrent.trim(), null);
            }
            log.info("Write-current key {} taken from active rotation job {} ({})", target, job.getId(), job.getStatus());
            return target;
        }

        if (configured) {
            log.info("Write-current key {} taken from configuration", configuredCurrent);
            return configuredCurrent.trim();
        }

        List<RotationJob> history = jobRepository.findAllNewestFirst();
        if (!history.isEmpty()) {
            RotationJob latest = history.get(0);
            String fromHistory = latest.getStatus() == RotationStatus.ROLLED_BACK
                ? latest.getSourceVersion()
                : latest.getTargetVersion();
            log.info("Write-current key {} derived from rotation job {} ({})",
                fromHistory, latest.getId(), latest.getStatus());
            return fromHistory;
        }

        return usable.last();
    }
}
