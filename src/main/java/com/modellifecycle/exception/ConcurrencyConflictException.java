package com.modellifecycle.exception;

public class ConcurrencyConflictException extends ModelLifecycleException {
    public ConcurrencyConflictException(String scope, String modelName, int attempts) {
        super("BUSY",
              "Could not acquire the " + scope + " lock for model '" + modelName
                  + "' after " + attempts + " attempts. Please try again later.");
    }
}
