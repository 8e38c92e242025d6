package com.keystone.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of one workflow node for one execution attempt. Set by whoever runs the node;
 * the router only reads it.
 */
public enum NodeStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMEOUT,
    SKIPPED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    /** Case-insensitive; null or unknown values return null (status unknown). */
    @JsonCreator
    public static NodeStatus fromValue(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toUpperCase();
        for (NodeStatus s : values()) {
            if (s.name().equals(normalized)) return s;
        }
        return null;
    }
}
