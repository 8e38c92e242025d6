package com.keystone.routing.metrics;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared per-node metrics. Updates for the same node are serialized through
 * {@link ConcurrentHashMap#compute}; reads return immutable snapshots.
 */
public final class ExecutionMetricsTable {

    private final Map<String, ExecutionMetrics> metrics = new ConcurrentHashMap<>();

    public ExecutionMetrics recordSuccess(String node, Duration elapsed) {
        return metrics.compute(node, (k, current) -> orInitial(current).afterSuccess(elapsed));
    }

    public ExecutionMetrics recordFailure(String node) {
        return metrics.compute(node, (k, current) -> orInitial(current).afterFailure());
    }

    public Optional<ExecutionMetrics> get(String node) {
        return Optional.ofNullable(metrics.get(node));
    }

    /** Point-in-time copy, e.g. for {@code WorkflowRoutingState.executionMetrics}. */
    public Map<String, ExecutionMetrics> snapshot() {
        return Map.copyOf(metrics);
    }

    public void clear() {
        metrics.clear();
    }

    private static ExecutionMetrics orInitial(ExecutionMetrics current) {
        return current != null ? current : ExecutionMetrics.initial();
    }
}
