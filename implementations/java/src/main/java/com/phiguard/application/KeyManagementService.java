package com.phiguard.application;

import com.phiguard.config.PerformanceConfiguration.RotationMetrics;
import com.phiguard.config.PhiGuardProperties;
import com.phiguard.domain.model.KeyVersion;
import com.phiguard.domain.model.RetiredKey;
import com.phiguard.domain.repository.RetiredKeyRepository;
import com.phiguard.infrastructure.audit.RotationAuditEvent;
import com.phiguard.infrastructure.audit.RotationAuditPublisher;
import com.phiguard.infrastructure.keys.KeyRegistry;
import com.phiguard.infrastructure.keys.KeySupply;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Operator-facing key lifecycle: listing, retirement, rotation policy.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KeyManagementService {

    private final KeyRegistry keyRegistry;
    private final KeySupply keySupply;
    private final RetiredKeyRepository retiredKeyRepository;
    private final RotationAuditPublisher auditPublisher;
    private final RotationMetrics metrics;
    private final PhiGuardProperties properties;
    private final Clock clock;

    public List<KeyVersion> versions() {
        return keyRegistry.snapshot();
    }

    public String currentWriteVersion() {
        return keyRegistry.currentWriteLabel();
    }

    public boolean isRotationDue() {
        return keyRegistry.isRotationDue(properties.getEncryption().getMaxKeyAge());
    }

    /**
     * Retires {@code label} and records it so the key stays retired after a restart.
     *
     * <p>Retrying after a failed save is safe: retiring an already retired key is a no-op.
     *
     * @throws com.phiguard.infrastructure.keys.KeyRetirementException if the key is still needed
     */
    public KeyVersion retire(String label, String requestedBy) {
        keyRegistry.retire(label);
        retiredKeyRepository.save(new RetiredKey(label, requestedBy, clock.instant()));
        keySupply.invalidate(label);
        log.info("Key {} retired by {}", label, requestedBy);
        metrics.recordKeyRetired(label);
        auditPublisher.publish(RotationAuditEvent.keyRetired(label, clock.instant()));
        return keyRegistry.find(label).orElseThrow();
    }
}
