package com.phiguard.domain.model;

/**
 * Thrown when a rotation operation is not allowed in the job's current state.
 */
public class RotationStateException extends IllegalStateException {

    public RotationStateException(String message) {
        super(message);
    }

    public RotationStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
