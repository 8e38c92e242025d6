package com.keystone.routing.metrics;

import com.keystone.config.RoutingDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Circuit breaker per node name, shared by concurrent executions. Each update is an atomic
 * read-modify-write on that node's state.
 */
public final class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final int threshold;
    private final Map<String, CircuitBreakerState> states = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(int threshold) {
        this.threshold = RoutingDefaults.requireThreshold("circuitBreakerThreshold", threshold);
    }

    public CircuitBreakerState record(String node, boolean success) {
        CircuitBreakerState updated = states.compute(node, (k, current) -> {
            CircuitBreakerState base = current != null ? current : CircuitBreakerState.closed(threshold);
            return success ? base.afterSuccess() : base.afterFailure();
        });
        if (!success && updated.open() && updated.failureCount() == threshold) {
            log.warn("Circuit breaker opened for node {} after {} consecutive failures", node, updated.failureCount());
        }
        return updated;
    }

    public CircuitBreakerState get(String node) {
        return states.getOrDefault(node, CircuitBreakerState.closed(threshold));
    }

    public boolean isOpen(String node) {
        return get(node).open();
    }

    public int getThreshold() {
        return threshold;
    }
}
