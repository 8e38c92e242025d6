package com.keystone.routing.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Failure counter and open flag for one node. After every transition
 * {@code open == (failureCount >= threshold)}; one success closes it and resets the count.
 */
public record CircuitBreakerState(
        @JsonProperty("circuit_breaker_open") boolean open,
        @JsonProperty("circuit_breaker_failures") int failureCount,
        @JsonProperty("circuit_breaker_threshold") int threshold
) {
    public CircuitBreakerState {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1, was " + threshold);
        }
        if (failureCount < 0) {
            throw new IllegalArgumentException("failureCount must be >= 0, was " + failureCount);
        }
    }

    public static CircuitBreakerState closed(int threshold) {
        return new CircuitBreakerState(false, 0, threshold);
    }

    public CircuitBreakerState afterSuccess() {
        return new CircuitBreakerState(false, 0, threshold);
    }

    public CircuitBreakerState afterFailure() {
        int failures = failureCount + 1;
        return new CircuitBreakerState(failures >= threshold, failures, threshold);
    }
}
