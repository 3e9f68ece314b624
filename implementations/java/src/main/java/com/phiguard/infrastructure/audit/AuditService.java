package com.phiguard.infrastructure.audit;

/**
 * Append-only sink for rotation audit events.
 * The default implementation logs; a durable store plugs in behind this interface.
 */
public interface AuditService {
    void record(RotationAuditEvent event);
}
