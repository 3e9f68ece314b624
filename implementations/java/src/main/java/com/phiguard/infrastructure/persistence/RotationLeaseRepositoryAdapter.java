package com.phiguard.infrastructure.persistence;

import com.phiguard.domain.repository.RotationLeaseRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class RotationLeaseRepositoryAdapter implements RotationLeaseRepository {

    private final SpringDataRotationLeaseRepository springDataRepository;

    @Override
    public boolean tryAcquire(UUID jobId, String owner, Instant expiresAt, Instant now) {
        boolean acquired = springDataRepository.upsertLease(jobId, owner, expiresAt, now) == 1;
        if (!acquired) {
            log.debug("Lease for job {} held by another instance", jobId);
        }
        return acquired;
    }

    @Override
    public void release(UUID jobId) {
        if (springDataRepository.existsById(jobId)) {
            springDataRepository.deleteById(jobId);
            log.debug("Lease for job {} released", jobId);
        }
    }
}
