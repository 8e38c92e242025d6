package com.keystone.routing;

import com.fasterxml.jackson.annotation.JsonValue;

/** Metric optimized by {@link WorkflowRouter#routeByPerformanceMetrics}. */
public enum PerformanceMetric {
    /** Higher is better. */
    SUCCESS_RATE,
    /** Lower is better. */
    AVG_EXECUTION_TIME;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
