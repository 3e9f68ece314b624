package com.phiguard.application;

import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.repository.ProtectedFieldRepository;
import com.phiguard.domain.repository.RotationJobRepository;
import com.phiguard.infrastructure.keys.RetirementGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * A key may be retired only when:
 * <ul>
 *   <li>no active rotation job names it as source or target</li>
 *   <li>a completed rotation away from it confirmed zero remaining rows</li>
 *   <li>no row is tagged with it right now</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class RotationRetirementGuard implements RetirementGuard {

    private final RotationJobRepository jobRepository;
    private final ProtectedFieldRepository fieldRepository;

    @Override
    public Optional<String> blockingReason(String label) {
        List<RotationJob> jobs = jobRepository.findByVersion(label);

        Optional<RotationJob> active = jobs.stream().filter(RotationJob::isActive).findFirst();
        if (active.isPresent()) {
            return Optional.of("rotation job " + active.get().getId() + " is still " + active.get().getStatus());
        }

        if (jobs.stream().noneMatch(job -> job.confirmsNoRowsUnder(label))) {
            return Optional.of("no completed rotation away from it confirmed zero remaining rows");
        }

        long live = fieldRepository.countByKeyVersion(label);
        if (live > 0) {
            return Optional.of(live + " rows are still encrypted under it");
        }
        return Optional.empty();
    }
}
