package com.phiguard.domain.repository;

import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.model.RotationStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable store for rotation jobs and their checkpoints.
 *
 * <p>{@link #save} persists the checkpoint together with the job; implementations backed by
 * a database must reject stale writes (optimistic version check).
 */
public interface RotationJobRepository {

    Optional<RotationJob> findById(UUID id);

    RotationJob save(RotationJob job);

    List<RotationJob> findByStatusIn(Collection<RotationStatus> statuses);

    List<RotationJob> findAllNewestFirst();

    /**
     * Jobs that reference {@code label} as source or target.
     */
    List<RotationJob> findByVersion(String label);
}
