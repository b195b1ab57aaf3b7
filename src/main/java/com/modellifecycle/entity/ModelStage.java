package com.modellifecycle.entity;

public enum ModelStage {
    NONE,
    STAGING,
    PRODUCTION,
    ARCHIVED
}
