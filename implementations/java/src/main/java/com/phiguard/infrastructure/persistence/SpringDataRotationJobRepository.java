package com.phiguard.infrastructure.persistence;

import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.model.RotationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface SpringDataRotationJobRepository extends JpaRepository<RotationJob, UUID> {

    List<RotationJob> findByStatusInOrderByCreatedAtAsc(Collection<RotationStatus> statuses);

    List<RotationJob> findAllByOrderByCreatedAtDesc();

    List<RotationJob> findBySourceVersionOrTargetVersion(String sourceVersion, String targetVersion);
}
