package com.phiguard.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Rotation Job Aggregate Root.
 *
 * <p>Tracks the migration of every protected field from {@code sourceVersion} to
 * {@code targetVersion}. The job is advanced one batch at a time and carries its own durable
 * checkpoint, so it can be hosted by any scheduler and resumed after a crash.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Status changes follow {@link RotationStatus#canTransitionTo}</li>
 *   <li>The checkpoint cursor never moves backwards</li>
 *   <li>Completion requires an exhausted cursor; leftover source rows or failed rows
 *       additionally require an explicit partial acceptance</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@Entity
@Table(name = "rotation_jobs")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class RotationJob {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "source_version", nullable = false, updatable = false, length = 16)
    private String sourceVersion;

    @Column(name = "target_version", nullable = false, updatable = false, length = 16)
    private String targetVersion;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RotationStatus status;

    @Embedded
    private RotationCheckpoint checkpoint;

    /**
     * Row count observed when the job was created.
     */
    @Column(name = "total_rows", nullable = false)
    private long totalRows;

    /**
     * True once a batch came back shorter than requested.
     */
    @Column(name = "exhausted", nullable = false)
    private boolean exhausted;

    @Column(name = "abort_on_first_failure", nullable = false)
    private boolean abortOnFirstFailure;

    @Column(name = "accepted_partial", nullable = false)
    private boolean acceptedPartial;

    /**
     * Rows still tagged with the source version when the job completed.
     */
    @Column(name = "remaining_source_rows")
    private Long remainingSourceRows;

    @Column(name = "last_error", length = 512)
    private String lastError;

    @Column(name = "requested_by", length = 128)
    private String requestedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    private RotationJob(
            UUID id,
            String sourceVersion,
            String targetVersion,
            long totalRows,
            boolean abortOnFirstFailure,
            String requestedBy,
            Instant now) {

        this.id = id;
        this.sourceVersion = sourceVersion;
        this.targetVersion = targetVersion;
        this.status = RotationStatus.PENDING;
        this.checkpoint = RotationCheckpoint.initial();
        this.totalRows = totalRows;
        this.abortOnFirstFailure = abortOnFirstFailure;
        this.requestedBy = requestedBy;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Factory method for a new job with its cursor at the start of the dataset.
     */
    public static RotationJob create(
            UUID id,
            String sourceVersion,
            String targetVersion,
            long totalRows,
            boolean abortOnFirstFailure,
            String requestedBy,
            Instant now) {

        Objects.requireNonNull(id, "Job ID must not be null");
        if (!EncryptedValue.isValidLabel(sourceVersion) || !EncryptedValue.isValidLabel(targetVersion)) {
            throw new IllegalArgumentException("Source and target must be key version labels");
        }
        if (sourceVersion.equals(targetVersion)) {
            throw new IllegalArgumentException("Source and target versions must differ");
        }
        if (totalRows < 0) {
            throw new IllegalArgumentException("Total rows must not be negative");
        }

        return new RotationJob(id, sourceVersion, targetVersion, totalRows,
            abortOnFirstFailure, requestedBy, now);
    }

    public boolean isActive() {
        return !status.isTerminal();
    }

    /**
     * PENDING → RUNNING on the first step; no-op when already running.
     */
    public void markRunning(Instant now) {
        if (status == RotationStatus.RUNNING) {
            return;
        }
        if (status != RotationStatus.PENDING) {
            throw new RotationStateException("Job " + id + " cannot run from " + status);
        }
        transitionTo(RotationStatus.RUNNING, now);
    }

    /**
     * Records a fully processed batch.
     */
    public void commitBatch(Long lastRowId, RotationCheckpoint.BatchCounters counters,
                            boolean batchWasShort, Instant now) {
        if (status != RotationStatus.RUNNING) {
            throw new RotationStateException("Job " + id + " is " + status + ", not RUNNING");
        }
        this.checkpoint = checkpoint.advance(lastRowId, counters, now);
        this.exhausted = batchWasShort;
        this.updatedAt = now;
    }

    public void pause(Instant now) {
        if (status != RotationStatus.RUNNING) {
            throw new RotationStateException("Only a running job can be paused, job " + id + " is " + status);
        }
        transitionTo(RotationStatus.PAUSED, now);
    }

    public void resume(Instant now) {
        if (status != RotationStatus.PAUSED) {
            throw new RotationStateException("Only a paused job can be resumed, job " + id + " is " + status);
        }
        transitionTo(RotationStatus.RUNNING, now);
    }

    /**
     * Marks the job completed.
     *
     * @param remainingSourceRows rows still tagged with the source version right now
     * @param acceptPartial operator accepts failed or leftover rows
     * @throws RotationStateException if the job has not scanned the whole dataset, or if rows
     *         remain under the source version or failed without an explicit partial acceptance
     */
    public void complete(long remainingSourceRows, boolean acceptPartial, Instant now) {
        requireTransition(RotationStatus.COMPLETED);
        if (!exhausted) {
            throw new RotationStateException(
                "Job " + id + " has not scanned the whole dataset (cursor=" + checkpoint.getCursor() + ")");
        }
        boolean clean = checkpoint.getFailed() == 0 && remainingSourceRows == 0;
        if (!clean && !acceptPartial) {
            throw new RotationStateException(String.format(
                "Job %s cannot complete: %d rows still under %s, %d rows failed",
                id, remainingSourceRows, sourceVersion, checkpoint.getFailed()));
        }
        this.remainingSourceRows = remainingSourceRows;
        this.acceptedPartial = !clean;
        transitionTo(RotationStatus.COMPLETED, now);
        this.finishedAt = now;
    }

    public void fail(String reason, Instant now) {
        requireTransition(RotationStatus.FAILED);
        this.lastError = truncate(reason);
        transitionTo(RotationStatus.FAILED, now);
        this.finishedAt = now;
    }

    public void rollBack(String reason, Instant now) {
        requireTransition(RotationStatus.ROLLED_BACK);
        this.lastError = truncate(reason);
        transitionTo(RotationStatus.ROLLED_BACK, now);
        this.finishedAt = now;
    }

    /**
     * True when this job proved that no row is left under {@code label}.
     */
    public boolean confirmsNoRowsUnder(String label) {
        return status == RotationStatus.COMPLETED
            && sourceVersion.equals(label)
            && remainingSourceRows != null
            && remainingSourceRows == 0;
    }

    public void recordError(String reason, Instant now) {
        this.lastError = truncate(reason);
        this.updatedAt = now;
    }

    private void requireTransition(RotationStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new RotationStateException(
                "Job " + id + " cannot move from " + status + " to " + next);
        }
    }

    private void transitionTo(RotationStatus next, Instant now) {
        requireTransition(next);
        this.status = next;
        this.updatedAt = now;
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= 512) {
            return reason;
        }
        return reason.substring(0, 512);
    }
}
