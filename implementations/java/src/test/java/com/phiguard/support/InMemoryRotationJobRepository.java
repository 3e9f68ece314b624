package com.phiguard.support;

import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.model.RotationStatus;
import com.phiguard.domain.repository.RotationJobRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

public class InMemoryRotationJobRepository implements RotationJobRepository {

    private final Map<UUID, RotationJob> jobs = Collections.synchronizedMap(new LinkedHashMap<>());

    @Override
    public Optional<RotationJob> findById(UUID id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public RotationJob save(RotationJob job) {
        jobs.put(job.getId(), job);
        return job;
    }

    @Override
    public List<RotationJob> findByStatusIn(Collection<RotationStatus> statuses) {
        return snapshot().stream()
            .filter(job -> statuses.contains(job.getStatus()))
            .collect(Collectors.toList());
    }

    @Override
    public List<RotationJob> findAllNewestFirst() {
        List<RotationJob> all = snapshot();
        Collections.reverse(all);
        return all;
    }

    @Override
    public List<RotationJob> findByVersion(String label) {
        return snapshot().stream()
            .filter(job -> job.getSourceVersion().equals(label) || job.getTargetVersion().equals(label))
            .collect(Collectors.toList());
    }

    private List<RotationJob> snapshot() {
        synchronized (jobs) {
            return new ArrayList<>(jobs.values());
        }
    }
}
