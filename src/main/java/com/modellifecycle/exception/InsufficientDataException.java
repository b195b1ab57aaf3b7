package com.modellifecycle.exception;

public class InsufficientDataException extends ValidationException {
    public InsufficientDataException(String message) {
        super("INSUFFICIENT_DATA", message);
    }
}
