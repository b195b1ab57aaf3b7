package com.modellifecycle.exception;

public class ModelVersionNotFoundException extends ModelLifecycleException {
    public ModelVersionNotFoundException(String modelName, int versionNumber) {
        super("MODEL_VERSION_NOT_FOUND",
              "Model '" + modelName + "' has no version " + versionNumber + ".");
    }
}
