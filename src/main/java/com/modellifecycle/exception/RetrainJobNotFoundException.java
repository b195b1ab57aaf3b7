package com.modellifecycle.exception;

import java.util.UUID;

public class RetrainJobNotFoundException extends ModelLifecycleException {
    public RetrainJobNotFoundException(UUID jobId) {
        super("RETRAIN_JOB_NOT_FOUND", "Retrain job with id '" + jobId + "' not found.");
    }
}
