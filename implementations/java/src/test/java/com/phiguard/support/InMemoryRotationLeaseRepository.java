package com.phiguard.support;

import com.phiguard.domain.model.RotationLease;
import com.phiguard.domain.repository.RotationLeaseRepository;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemoryRotationLeaseRepository implements RotationLeaseRepository {

    private final Map<UUID, RotationLease> leases = new HashMap<>();

    @Override
    public synchronized boolean tryAcquire(UUID jobId, String owner, Instant expiresAt, Instant now) {
        RotationLease current = leases.get(jobId);
        if (current == null || current.isHeldBy(owner, now) || current.isExpired(now)) {
            leases.put(jobId, new RotationLease(jobId, owner, expiresAt));
            return true;
        }
        return false;
    }

    @Override
    public synchronized void release(UUID jobId) {
        leases.remove(jobId);
    }

    public synchronized Optional<RotationLease> find(UUID jobId) {
        return Optional.ofNullable(leases.get(jobId));
    }
}
