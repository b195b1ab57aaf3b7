package com.modellifecycle.exception;

public class ValidationException extends ModelLifecycleException {
    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
    protected ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
