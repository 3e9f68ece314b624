package com.phiguard.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget front of the audit sink: a failing sink never fails a rotation step.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RotationAuditPublisher {

    private final AuditService auditService;

    public void publish(RotationAuditEvent event) {
        try {
            auditService.record(event);
        } catch (RuntimeException e) {
            log.error("Audit sink rejected {} event for job {}", event.getType(), event.getJobId(), e);
        }
    }
}
