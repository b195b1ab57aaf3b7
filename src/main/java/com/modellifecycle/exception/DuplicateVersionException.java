package com.modellifecycle.exception;

public class DuplicateVersionException extends ModelLifecycleException {
    public DuplicateVersionException(String modelName, String detail) {
        super("DUPLICATE_VERSION",
              "Model '" + modelName + "' already has a version with " + detail + ".");
    }
}
