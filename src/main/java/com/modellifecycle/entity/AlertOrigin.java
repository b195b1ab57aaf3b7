package com.modellifecycle.entity;

public enum AlertOrigin {
    INTERNAL,
    INBOUND
}
