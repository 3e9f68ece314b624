package com.phiguard.infrastructure.keys;

import java.util.Optional;

/**
 * Decides whether a read-only key version may be retired.
 */
@FunctionalInterface
public interface RetirementGuard {

    /**
     * @return empty if {@code label} can be retired, otherwise the reason it cannot
     */
    Optional<String> blockingReason(String label);
}
