package com.phiguard.interfaces.api.dto;

import com.phiguard.domain.model.RotationCheckpoint;
import com.phiguard.domain.model.RotationJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for a rotation job and its checkpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RotationJobResponse {

    private UUID id;
    private String sourceVersion;
    private String targetVersion;
    private String status;
    private Long cursor;
    private long totalRows;
    private long scanned;
    private long migrated;
    private long skipped;
    private long failed;
    private long batchesCommitted;
    private boolean exhausted;
    private boolean abortOnFirstFailure;
    private boolean acceptedPartial;
    private Long remainingSourceRows;
    private String lastError;
    private String requestedBy;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant finishedAt;

    public static RotationJobResponse from(RotationJob job) {
        RotationCheckpoint checkpoint = job.getCheckpoint();
        return RotationJobResponse.builder()
            .id(job.getId())
            .sourceVersion(job.getSourceVersion())
            .targetVersion(job.getTargetVersion())
            .status(job.getStatus().name())
            .cursor(checkpoint.getCursor())
            .totalRows(job.getTotalRows())
            .scanned(checkpoint.getScanned())
            .migrated(checkpoint.getMigrated())
            .skipped(checkpoint.getSkipped())
            .failed(checkpoint.getFailed())
            .batchesCommitted(checkpoint.getBatchesCommitted())
            .exhausted(job.isExhausted())
            .abortOnFirstFailure(job.isAbortOnFirstFailure())
            .acceptedPartial(job.isAcceptedPartial())
            .remainingSourceRows(job.getRemainingSourceRows())
            .lastError(job.getLastError())
            .requestedBy(job.getRequestedBy())
            .createdAt(job.getCreatedAt())
            .updatedAt(job.getUpdatedAt())
            .finishedAt(job.getFinishedAt())
            .build();
    }
}
