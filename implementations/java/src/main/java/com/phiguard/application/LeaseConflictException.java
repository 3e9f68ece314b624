package com.phiguard.application;

import java.util.UUID;

/**
 * Another worker currently owns the job. Nothing was changed.
 */
public class LeaseConflictException extends RuntimeException {

    private final UUID jobId;

    public LeaseConflictException(UUID jobId, String reason) {
        super("Rotation job " + jobId + " is busy: " + reason);
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
