package com.modellifecycle.entity;

public enum TriggerSource {
    MANUAL,
    ALERT
}
