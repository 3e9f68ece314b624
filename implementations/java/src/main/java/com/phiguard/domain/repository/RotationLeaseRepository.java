package com.phiguard.domain.repository;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-job advisory lease store.
 */
public interface RotationLeaseRepository {

    /**
     * Takes or renews the lease for {@code owner}.
     *
     * <p>Succeeds when no lease exists, when {@code owner} already holds it, or when the
     * current holder's lease expired before {@code now}. Must be atomic.
     *
     * @return true if {@code owner} holds the lease until {@code expiresAt}
     */
    boolean tryAcquire(UUID jobId, String owner, Instant expiresAt, Instant now);

    /**
     * Drops the lease regardless of holder (terminal job states).
     */
    void release(UUID jobId);
}
