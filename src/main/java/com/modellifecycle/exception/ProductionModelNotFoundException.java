package com.modellifecycle.exception;

public class ProductionModelNotFoundException extends ModelLifecycleException {
    public ProductionModelNotFoundException(String modelName) {
        super("PRODUCTION_MODEL_NOT_FOUND", "Model '" + modelName + "' has no Production version.");
    }
}
