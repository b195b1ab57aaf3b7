package com.modellifecycle.domain;

public enum TriggerOutcome {
    QUEUED,
    REJECTED_ALREADY_IN_FLIGHT,
    DUPLICATE_ALERT
}
