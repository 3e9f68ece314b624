package com.phiguard.application;

import com.phiguard.domain.model.RotationCheckpoint;
import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.model.RotationStatus;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one {@link RotationOrchestrator#step} call.
 *
 * @param batch counters of this batch only
 * @param failedRowIds ids of rows that failed in this batch, ascending
 */
public record BatchResult(
        UUID jobId,
        RotationStatus status,
        RotationCheckpoint.BatchCounters batch,
        Long cursor,
        boolean exhausted,
        List<Long> failedRowIds) {

    static BatchResult of(RotationJob job, RotationCheckpoint.BatchCounters batch, List<Long> failedRowIds) {
        return new BatchResult(job.getId(), job.getStatus(), batch,
            job.getCheckpoint().getCursor(), job.isExhausted(), List.copyOf(failedRowIds));
    }
}
