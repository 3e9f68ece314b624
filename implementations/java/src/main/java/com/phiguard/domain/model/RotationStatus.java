package com.phiguard.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link RotationJob}.
 *
 * <pre>
 * PENDING → RUNNING → {COMPLETED | FAILED | PAUSED ⇄ RUNNING | ROLLED_BACK}
 * </pre>
 */
public enum RotationStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    ROLLED_BACK;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ROLLED_BACK;
    }

    /**
     * Statuses from which {@code step()} may advance the cursor.
     */
    public boolean isSteppable() {
        return this == PENDING || this == RUNNING;
    }

    public boolean canTransitionTo(RotationStatus next) {
        return allowedNext().contains(next);
    }

    private Set<RotationStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, FAILED, ROLLED_BACK);
            case RUNNING -> EnumSet.of(PAUSED, COMPLETED, FAILED, ROLLED_BACK);
            case PAUSED -> EnumSet.of(RUNNING, COMPLETED, FAILED, ROLLED_BACK);
            case COMPLETED, FAILED, ROLLED_BACK -> EnumSet.noneOf(RotationStatus.class);
        };
    }

    public static Set<RotationStatus> active() {
        return EnumSet.of(PENDING, RUNNING, PAUSED);
    }
}
