package com.keystone.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Severity attached to a routing state when an error occurs. {@link #CRITICAL} bypasses retries. */
public enum ErrorSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    /** Unknown or missing values map to {@link #LOW}. */
    @JsonCreator
    public static ErrorSeverity fromValue(String value) {
        if (value == null || value.isBlank()) return LOW;
        String normalized = value.trim().toUpperCase();
        for (ErrorSeverity s : values()) {
            if (s.name().equals(normalized)) return s;
        }
        return LOW;
    }
}
