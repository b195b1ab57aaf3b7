package com.modellifecycle.domain;

public enum PromotionPolicy {
    ALWAYS,
    IF_BETTER,
    REGISTER_ONLY
}
