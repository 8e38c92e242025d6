package com.keystone.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How a {@link RoutingDecision} was reached. Serialized as snake_case (e.g. {@code retry_with_backoff}). */
public enum RoutingStrategy {
    SUCCESS_PATH,
    ERROR_FALLBACK,
    RETRY_WITH_BACKOFF,
    PARALLEL_BRANCH,
    ADAPTIVE_SELECTION,
    /** Circuit open for the node; routed to the error node instead of raising. */
    CIRCUIT_BREAKER,
    CONDITIONAL_BRANCH;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static RoutingStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Routing strategy is required");
        }
        String normalized = value.trim().toUpperCase();
        for (RoutingStrategy s : values()) {
            if (s.name().equals(normalized)) return s;
        }
        throw new IllegalArgumentException("Unknown routing strategy: " + value);
    }
}
