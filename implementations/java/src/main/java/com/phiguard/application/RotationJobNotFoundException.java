package com.phiguard.application;

import java.util.UUID;

public class RotationJobNotFoundException extends RuntimeException {

    public RotationJobNotFoundException(UUID jobId) {
        super("Rotation job not found: " + jobId);
    }
}
