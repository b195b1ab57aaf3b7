package com.modellifecycle.exception;

public class ModelServingException extends ModelLifecycleException {
    public ModelServingException(String message) {
        super("MODEL_SERVING_ERROR", message);
    }
}
