package com.phiguard.infrastructure.audit;

import com.phiguard.domain.model.RotationCheckpoint;
import com.phiguard.domain.model.RotationJob;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit record of a rotation or key lifecycle step.
 *
 * <p>Carries identifiers and counters only. Never plaintext, ciphertext or key material.
 */
@Value
@Builder
public class RotationAuditEvent {

    /**
     * Null for key events that are not tied to a job.
     */
    UUID jobId;

    AuditEventType type;

    String sourceVersion;

    String targetVersion;

    long scanned;
    long migrated;
    long skipped;
    long failed;

    String detail;

    Instant occurredAt;

    public static RotationAuditEvent of(RotationJob job, AuditEventType type, String detail, Instant at) {
        RotationCheckpoint checkpoint = job.getCheckpoint();
        return RotationAuditEvent.builder()
            .jobId(job.getId())
            .type(type)
            .sourceVersion(job.getSourceVersion())
            .targetVersion(job.getTargetVersion())
            .scanned(checkpoint.getScanned())
            .migrated(checkpoint.getMigrated())
            .skipped(checkpoint.getSkipped())
            .failed(checkpoint.getFailed())
            .detail(detail)
            .occurredAt(at)
            .build();
    }

    public static RotationAuditEvent keyRetired(String label, Instant at) {
        return RotationAuditEvent.builder()
            .type(AuditEventType.KEY_RETIRED)
            .sourceVersion(label)
            .occurredAt(at)
            .build();
    }
}
