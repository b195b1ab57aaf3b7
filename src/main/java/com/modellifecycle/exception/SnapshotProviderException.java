package com.modellifecycle.exception;

public class SnapshotProviderException extends ModelLifecycleException {
    public SnapshotProviderException(String message) {
        super("SNAPSHOT_PROVIDER_ERROR", message);
    }
    public SnapshotProviderException(String message, Throwable cause) {
        super("SNAPSHOT_PROVIDER_ERROR", message, cause);
    }
}
