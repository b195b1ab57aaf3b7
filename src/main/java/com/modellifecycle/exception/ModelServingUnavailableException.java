package com.modellifecycle.exception;

public class ModelServingUnavailableException extends ModelLifecycleException {
    public ModelServingUnavailableException(Throwable cause) {
        super("MODEL_SERVING_UNAVAILABLE",
              "The model serving runtime is currently unavailable. Please try again later.",
              cause);
    }
}
