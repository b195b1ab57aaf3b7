package com.modellifecycle.exception;

import com.modellifecycle.entity.RetrainJobStatus;

import java.util.UUID;

public class JobNotCancellableException extends ModelLifecycleException {
    public JobNotCancellableException(UUID jobId, RetrainJobStatus status) {
        super("JOB_NOT_CANCELLABLE",
              "Retrain job '" + jobId + "' is " + status + "; only QUEUED jobs can be cancelled.");
    }
}
