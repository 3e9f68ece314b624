package com.phiguard.application;

import com.phiguard.config.PhiGuardProperties;
import com.phiguard.domain.model.RotationJob;
import com.phiguard.domain.model.RotationStateException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background driver that steps active rotation jobs.
 *
 * <p>Each tick processes one batch per steppable job. Failures are logged and retried on the
 * next tick from the last committed checkpoint.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RotationJobRunner {

    private final RotationOrchestrator orchestrator;
    private final PhiGuardProperties properties;

    @Scheduled(fixedDelayString = "${phiguard.rotation.poll-interval:PT5S}")
    public void tick() {
        PhiGuardProperties.Rotation settings = properties.getRotation();
        if (!settings.isRunnerEnabled()) {
            return;
        }

        for (RotationJob job : orchestrator.activeJobs()) {
            if (!job.getStatus().isSteppable()) {
                continue;
            }
            try {
                BatchResult result = orchestrator.step(job.getId(), settings.getBatchSize());
                if (result.exhausted() && settings.isAutoComplete()) {
                    orchestrator.complete(job.getId(), false);
                }
            } catch (LeaseConflictException e) {
                log.debug("Skipping job {}: {}", job.getId(), e.getMessage());
            } catch (RotationStateException e) {
                log.warn("Rotation job {} not advanced: {}", job.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Rotation job {} batch failed, will retry from last checkpoint", job.getId(), e);
            }
        }
    }
}
