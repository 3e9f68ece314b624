package com.phiguard.infrastructure.persistence;

import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.model.RotationStatus;
import com.phiguard.domain.repository.RotationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Adapter implementing the job store with Spring Data JPA.
 *
 * <p>Stale saves fail with Spring's {@code OptimisticLockingFailureException} through the
 * entity's {@code @Version} column.
 */
@Component
@Transactional
@RequiredArgsConstructor
@Slf4j
public class RotationJobRepositoryAdapter implements RotationJobRepository {

    private final SpringDataRotationJobRepository springDataRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<RotationJob> findById(UUID id) {
        return springDataRepository.findById(id);
    }

    @Override
    public RotationJob save(RotationJob job) {
        RotationJob saved = springDataRepository.saveAndFlush(job);
        log.debug("Rotation job persisted: id={}, status={}, cursor={}",
            saved.getId(), saved.getStatus(), saved.getCheckpoint().getCursor());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public List<RotationJob> findByStatusIn(Collection<RotationStatus> statuses) {
        return springDataRepository.findByStatusInOrderByCreatedAtAsc(statuses);
    }

    @Override
    @Transactional(readOnly = true)
    public List<RotationJob> findAllNewestFirst() {
        return springDataRepository.findAllByOrderByCreatedAtDesc();
    }

    @Override
    @Transactional(readOnly = true)
    public List<RotationJob> findByVersion(String label) {
        return springDataRepository.findBySourceVersionOrTargetVersion(label, label);
    }
}
