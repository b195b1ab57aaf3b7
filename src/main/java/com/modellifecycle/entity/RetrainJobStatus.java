package com.modellifecycle.entity;

import java.util.EnumSet;
import java.util.Set;

public enum RetrainJobStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public static final Set<RetrainJobStatus> IN_FLIGHT = EnumSet.of(QUEUED, RUNNING);
}
