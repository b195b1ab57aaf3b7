package com.modellifecycle.exception;

public class NoStagingCandidateException extends ModelLifecycleException {
    public NoStagingCandidateException(String modelName) {
        super("NO_STAGING_CANDIDATE", "Model '" + modelName + "' has no Staging version to promote.");
    }
}
