package com.modellifecycle.domain;

public enum BreachedCondition {
    MISSING_VALUES,
    COLUMN_DRIFT,
    PREDICTION_DRIFT
}
