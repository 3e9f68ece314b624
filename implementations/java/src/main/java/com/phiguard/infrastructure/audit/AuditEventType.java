package com.phiguard.infrastructure.audit;

public enum AuditEventType {
    STARTED,
    BATCH_COMPLETED,
    COMPLETED,
    FAILED,
    ROLLED_BACK,
    PAUSED,
    RESUMED,
    KEY_RETIRED
}
