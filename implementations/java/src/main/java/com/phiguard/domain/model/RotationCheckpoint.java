package com.phiguard.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Durable progress snapshot of a rotation job.
 *
 * <p>Saved with the job after every fully processed batch. {@code cursor} is the primary key
 * of the last row handled; {@code null} means the start of the dataset.
 */
@Embeddable
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RotationCheckpoint {

    @Column(name = "cursor_id")
    private Long cursor;

    @Column(name = "scanned", nullable = false)
    private long scanned;

    @Column(name = "migrated", nullable = false)
    private long migrated;

    @Column(name = "skipped", nullable = false)
    private long skipped;

    @Column(name = "failed", nullable = false)
    private long failed;

    @Column(name = "batches_committed", nullable = false)
    private long batchesCommitted;

    @Column(name = "checkpointed_at")
    private Instant checkpointedAt;

    public static RotationCheckpoint initial() {
        return new RotationCheckpoint(null, 0, 0, 0, 0, 0, null);
    }

    /**
     * Folds one batch into this checkpoint.
     *
     * @throws IllegalArgumentException if the cursor would move backwards
     */
    public RotationCheckpoint advance(Long newCursor, BatchCounters batch, Instant at) {
        if (newCursor == null) {
            newCursor = cursor;
        } else if (cursor != null && newCursor < cursor) {
            throw new IllegalArgumentException(
                "Cursor must be monotonic: " + newCursor + " < " + cursor);
        }
        return new RotationCheckpoint(
            newCursor,
            scanned + batch.scanned(),
            migrated + batch.migrated(),
            skipped + batch.skipped(),
            failed + batch.failed(),
            batchesCommitted + 1,
            at
        );
    }

    /**
     * Per-batch counter deltas.
     */
    public record BatchCounters(long scanned, long migrated, long skipped, long failed) {
        public static final BatchCounters EMPTY = new BatchCounters(0, 0, 0, 0);
    }
}
