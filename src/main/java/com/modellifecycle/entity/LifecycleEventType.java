package com.modellifecycle.entity;

public enum LifecycleEventType {
    VERSION_REGISTERED,
    STAGE_CHANGED,
    ALERT_RECORDED,
    EVALUATION_FAILED,
    RETRAIN_QUEUED,
    RETRAIN_REJECTED,
    RETRAIN_STARTED,
    RETRAIN_ATTEMPT_FAILED,
    RETRAIN_SUCCEEDED,
    RETRAIN_FAILED,
    RETRAIN_CANCELLED,
    RETRAIN_INTERRUPTED
}
