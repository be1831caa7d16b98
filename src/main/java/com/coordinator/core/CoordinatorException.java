package com.coordinator.core;

/**
 * Base type for expected, caller-visible coordinator failures (bad ids, duplicate
 * registration, illegal transitions). None of these leave partial state behind.
 */
public class CoordinatorException extends RuntimeException {
    public CoordinatorException(String message) {
        super(message);
    }
}
