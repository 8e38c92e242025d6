package com.keystone.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Router defaults applied when a routing state does not carry its own retry or circuit breaker values. */
public final class RoutingDefaults {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_CIRCUIT_BREAKER_THRESHOLD = 5;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    private final int maxRetries;
    private final int circuitBreakerThreshold;
    private final double backoffMultiplier;
    private final boolean recordHistory;

    @JsonCreator
    public RoutingDefaults(
            @JsonProperty("maxRetries") Integer maxRetries,
            @JsonProperty("circuitBreakerThreshold") Integer circuitBreakerThreshold,
            @JsonProperty("backoffMultiplier") Double backoffMultiplier,
            @JsonProperty("recordHistory") Boolean recordHistory) {
        this.maxRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
        this.circuitBreakerThreshold = circuitBreakerThreshold != null ? circuitBreakerThreshold : DEFAULT_CIRCUIT_BREAKER_THRESHOLD;
        this.backoffMultiplier = backoffMultiplier != null ? backoffMultiplier : DEFAULT_BACKOFF_MULTIPLIER;
        this.recordHistory = recordHistory != null && recordHistory;
    }

    public static RoutingDefaults defaults() {
        return new RoutingDefaults(null, null, null, null);
    }

    /**
     * Checks the values and returns this instance.
     *
     * @throws ConfigurationException when max retries is negative, the threshold is below 1
     *                                or the backoff multiplier is not positive
     */
    public RoutingDefaults validate() {
        requireMaxRetries("maxRetries", maxRetries);
        requireThreshold("circuitBreakerThreshold", circuitBreakerThreshold);
        requireBackoffMultiplier("backoffMultiplier", backoffMultiplier);
        return this;
    }

    public static int requireMaxRetries(String setting, int value) {
        if (value < 0) {
            throw new ConfigurationException(setting, "must be >= 0, was " + value);
        }
        return value;
    }

    public static int requireThreshold(String setting, int value) {
        if (value < 1) {
            throw new ConfigurationException(setting, "must be >= 1, was " + value);
        }
        return value;
    }

    public static double requireBackoffMultiplier(String setting, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new ConfigurationException(setting, "must be a positive finite number, was " + value);
        }
        return value;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public int getCircuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    /** Whether the router keeps an append-only log of its decisions. Default false. */
    public boolean isRecordHistory() {
        return recordHistory;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RoutingDefaults that = (RoutingDefaults) o;
        return maxRetries == that.maxRetries
                && circuitBreakerThreshold == that.circuitBreakerThreshold
                && Double.compare(backoffMultiplier, that.backoffMultiplier) == 0
                && recordHistory == that.recordHistory;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, circuitBreakerThreshold, backoffMultiplier, recordHistory);
    }
}
