package com.modellifecycle.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class PipelineFailureException extends ModelLifecycleException {

    private final boolean retryable;

    public PipelineFailureException(String message, boolean retryable) {
        super("PIPELINE_FAILURE", message);
        this.retryable = retryable;
    }

    public PipelineFailureException(String message, Throwable cause) {
        super("PIPELINE_FAILURE", message, cause);
        this.retryable = true;
    }

    public static PipelineFailureException timedOut(Duration timeout) {
        return new PipelineFailureException("Training pipeline did not finish within " + timeout, true);
    }
}
