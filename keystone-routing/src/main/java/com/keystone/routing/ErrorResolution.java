package com.keystone.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome chosen by an error handling node ({@code node_results.handle_error.strategy}).
 *
 * @see RoutingPresets#routeAfterErrorHandling(WorkflowRoutingState)
 */
public enum ErrorResolution {
    RETRY,
    ALTERNATIVE_PATH,
    TERMINATE;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    /** Unknown or missing values resolve to {@link #TERMINATE}. */
    @JsonCreator
    public static ErrorResolution fromValue(String value) {
        if (value == null || value.isBlank()) return TERMINATE;
        String normalized = value.trim().toUpperCase();
        for (ErrorResolution r : values()) {
            if (r.name().equals(normalized)) return r;
        }
        return TERMINATE;
    }
}
