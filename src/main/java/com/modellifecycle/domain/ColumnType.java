package com.modellifecycle.domain;

public enum ColumnType {
    NUMERIC,
    CATEGORICAL
}
