package com.keystone.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Normalized state of a queued task. Terminal states ({@link #SUCCESS}, {@link #FAILURE},
 * {@link #TIMEOUT}, {@link #CANCELLED}) accept no further transitions.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILURE,
    TIMEOUT,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static TaskState fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Task state is required");
        }
        return valueOf(value.trim().toUpperCase());
    }
}
