package com.phiguard.infrastructure.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class LoggingAuditService implements AuditService {

    @Override
    public void record(RotationAuditEvent event) {
        log.info("AUDIT type={} job={} source={} target={} scanned={} migrated={} skipped={} failed={} detail={} at={}",
                event.getType(), event.getJobId(), event.getSourceVersion(), event.getTargetVersion(),
                event.getScanned(), event.getMigrated(), event.getSkipped(), event.getFailed(),
                event.getDetail(), event.getOccurredAt());
    }
}
