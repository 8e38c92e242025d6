package com.keystone.routing;

import com.keystone.config.RoutingDefaults;
import com.keystone.routing.metrics.CircuitBreakerState;
import com.keystone.routing.metrics.ExecutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Routing decision engine. Every {@code route*} method is a pure function of its arguments and
 * never mutates the {@link WorkflowRoutingState}; circuit breaker and metrics updates are separate
 * explicit calls. Safe to share across threads.
 * <p>
 * When history recording is enabled the router appends every decision it returns to an
 * append-only log ({@link #getRoutingHistory()}); this does not influence later decisions.
 */
public final class WorkflowRouter {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRouter.class);

    private final int maxRetries;
    private final int circuitBreakerThreshold;
    private final double backoffMultiplier;
    private final boolean recordHistory;
    private final List<RoutingDecision> history = new CopyOnWriteArrayList<>();

    public WorkflowRouter() {
        this(RoutingDefaults.defaults());
    }

    public WorkflowRouter(int maxRetries, int circuitBreakerThreshold, double backoffMultiplier) {
        this(new RoutingDefaults(maxRetries, circuitBreakerThreshold, backoffMultiplier, false));
    }

    /**
     * @throws com.keystone.config.ConfigurationException when the defaults are out of range
     */
    public WorkflowRouter(RoutingDefaults defaults) {
        Objects.requireNonNull(defaults, "defaults").validate();
        this.maxRetries = defaults.getMaxRetries();
        this.circuitBreakerThreshold = defaults.getCircuitBreakerThreshold();
        this.backoffMultiplier = defaults.getBackoffMultiplier();
        this.recordHistory = defaults.isRecordHistory();
    }

    /**
     * Routes after {@code currentNode} ran. Precedence: critical error → open circuit → completed
     * → failed (retry while budget remains and {@code retryNode} is given) → timeout → success path.
     *
     * @param retryNode node to re-run on failure; null disables retry
     */
    public RoutingDecision routeAfterExecution(WorkflowRoutingState state, String currentNode,
                                               String successNode, String errorNode, String retryNode) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (state.getErrorSeverity() == ErrorSeverity.CRITICAL) {
            metadata.put("errors", state.getErrors());
            return record(RoutingDecision.of(RoutingDecision.TERMINAL, RoutingStrategy.ERROR_FALLBACK,
                    "Critical error in " + currentNode + ", terminating workflow", metadata));
        }
        if (state.isCircuitBreakerOpen()) {
            metadata.put("circuit_breaker_state", "open");
            return record(new RoutingDecision(errorNode, RoutingStrategy.CIRCUIT_BREAKER,
                    "Circuit breaker open for " + currentNode, metadata, List.of(RoutingDecision.TERMINAL)));
        }
        NodeStatus status = state.statusOf(currentNode);
        if (status == NodeStatus.COMPLETED) {
            metadata.put("execution_status", "success");
            return record(RoutingDecision.of(successNode, RoutingStrategy.SUCCESS_PATH,
                    "Node " + currentNode + " completed successfully", metadata));
        }
        if (status == NodeStatus.FAILED) {
            int retryCount = state.getRetryCount();
            int retries = effectiveMaxRetries(state);
            if (retryNode != null && retryCount < retries) {
                double backoff = Math.pow(effectiveBackoffMultiplier(state), retryCount);
                metadata.put("retry_count", retryCount + 1);
                metadata.put("backoff_seconds", backoff);
                metadata.put("errors", state.getErrors());
                return record(new RoutingDecision(retryNode, RoutingStrategy.RETRY_WITH_BACKOFF,
                        "Retrying " + currentNode + " (attempt " + (retryCount + 1) + "/" + retries + ")",
                        metadata, List.of(errorNode, RoutingDecision.TERMINAL)));
            }
            metadata.put("retry_count", retryCount);
            metadata.put("errors", state.getErrors());
            return record(RoutingDecision.of(errorNode, RoutingStrategy.ERROR_FALLBACK,
                    "Max retries exceeded for " + currentNode, metadata));
        }
        if (status == NodeStatus.TIMEOUT) {
            metadata.put("error_type", "timeout");
            return record(RoutingDecision.of(errorNode, RoutingStrategy.ERROR_FALLBACK,
                    "Timeout in " + currentNode, metadata));
        }
        metadata.put("note", "Status unclear, proceeding with success path");
        return record(RoutingDecision.of(successNode, RoutingStrategy.SUCCESS_PATH,
                "Default routing for " + currentNode, metadata));
    }

    public RoutingDecision routeAfterExecution(WorkflowRoutingState state, String currentNode,
                                               String successNode, String errorNode) {
        return routeAfterExecution(state, currentNode, successNode, errorNode, null);
    }

    /**
     * Looks up {@code node_results[currentNode][outputKey]} in {@code routingMap}. Keys match by
     * equality first, then by string form (so a JSON-loaded {@code "true"} key matches {@code Boolean.TRUE}).
     */
    public RoutingDecision routeByOutputValue(WorkflowRoutingState state, String currentNode, String outputKey,
                                              Map<?, String> routingMap, String defaultNode) {
        Object value = state.resultsOf(currentNode).get(outputKey);
        String next = lookup(routingMap, value);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("output_key", outputKey);
        metadata.put("output_value", value);
        metadata.put("routing_map", routingMap);
        return record(RoutingDecision.of(next != null ? next : defaultNode, RoutingStrategy.CONDITIONAL_BRANCH,
                "Routing based on " + outputKey + "=" + value, metadata));
    }

    private static String lookup(Map<?, String> routingMap, Object value) {
        for (Map.Entry<?, String> e : routingMap.entrySet()) {
            if (Objects.equals(e.getKey(), value)) {
                return e.getValue();
            }
        }
        if (value == null) {
            return null;
        }
        String text = value.toString();
        for (Map.Entry<?, String> e : routingMap.entrySet()) {
            if (e.getKey() != null && text.equals(e.getKey().toString())) {
                return e.getValue();
            }
        }
        return null;
    }

    /** Evaluates {@code rules} in order against {@code workflow_context[contextKey]}; first match wins. */
    public RoutingDecision routeByContext(WorkflowRoutingState state, String contextKey,
                                          List<ContextRule> rules, String defaultNode) {
        Object value = state.getWorkflowContext().get(contextKey);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("context_key", contextKey);
        metadata.put("context_value", value);
        for (ContextRule rule : rules) {
            if (rule.condition().test(value)) {
                String reason = rule.reason() != null ? rule.reason() : "Context rule matched: " + contextKey;
                return record(RoutingDecision.of(rule.node(), RoutingStrategy.CONDITIONAL_BRANCH, reason, metadata));
            }
        }
        return record(RoutingDecision.of(defaultNode, RoutingStrategy.CONDITIONAL_BRANCH,
                "No context rules matched for " + contextKey + ", using default", metadata));
    }

    /**
     * One decision per branch, each labelled with {@code join_node}. The caller owns the fan-in.
     */
    public List<RoutingDecision> routeParallelSplit(WorkflowRoutingState state, List<String> parallelNodes, String joinNode) {
        List<String> group = List.copyOf(parallelNodes);
        List<RoutingDecision> decisions = new ArrayList<>(group.size());
        for (String node : group) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("parallel_group", group);
            metadata.put("join_node", joinNode);
            metadata.put("branch_node", node);
            decisions.add(record(RoutingDecision.of(node, RoutingStrategy.PARALLEL_BRANCH,
                    "Parallel execution of " + node, metadata)));
        }
        return List.copyOf(decisions);
    }

    /**
     * {@code available = limit - usage} (missing limit 100, missing usage 0); intensive path iff
     * {@code available >= threshold}.
     */
    public RoutingDecision routeByResourceAvailability(WorkflowRoutingState state, String intensiveNode,
                                                       String lightweightNode, String resourceType, double threshold) {
        double limit = state.getResourceLimits().getOrDefault(resourceType, 100.0);
        double usage = state.getCurrentResourceUsage().getOrDefault(resourceType, 0.0);
        double available = limit - usage;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("resource_type", resourceType);
        metadata.put("available", available);
        metadata.put("threshold", threshold);
        if (available >= threshold) {
            return record(RoutingDecision.of(intensiveNode, RoutingStrategy.ADAPTIVE_SELECTION,
                    "Sufficient " + resourceType + " available for intensive path", metadata));
        }
        return record(RoutingDecision.of(lightweightNode, RoutingStrategy.ADAPTIVE_SELECTION,
                "Insufficient " + resourceType + ", using lightweight path", metadata));
    }

    /**
     * Picks the best option that has recorded metrics; the first option when none has any.
     *
     * @throws IllegalArgumentException when {@code nodeOptions} is empty
     */
    public RoutingDecision routeByPerformanceMetrics(WorkflowRoutingState state, List<String> nodeOptions,
                                                     PerformanceMetric metric) {
        if (nodeOptions == null || nodeOptions.isEmpty()) {
            throw new IllegalArgumentException("nodeOptions must not be empty");
        }
        String best = null;
        double bestValue = 0.0;
        for (String node : nodeOptions) {
            ExecutionMetrics m = state.getExecutionMetrics().get(node);
            if (m == null) continue;
            double value = switch (metric) {
                case SUCCESS_RATE -> m.successRate();
                case AVG_EXECUTION_TIME -> m.avgExecutionTime();
            };
            boolean better = switch (metric) {
                case SUCCESS_RATE -> value > bestValue;
                case AVG_EXECUTION_TIME -> value < bestValue;
            };
            if (best == null || better) {
                best = node;
                bestValue = value;
            }
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("metric", metric.toValue());
        metadata.put("value", best != null ? bestValue : "N/A");
        metadata.put("node_options", List.copyOf(nodeOptions));
        String chosen = best != null ? best : nodeOptions.get(0);
        return record(RoutingDecision.of(chosen, RoutingStrategy.ADAPTIVE_SELECTION,
                "Selected " + chosen + " based on " + metric.toValue() + "=" + metadata.get("value"), metadata));
    }

    /**
     * Next circuit breaker state for {@code node} from the state's counters: success resets to
     * closed with zero failures, failure increments and opens at the threshold.
     */
    public CircuitBreakerState updateCircuitBreaker(WorkflowRoutingState state, String node, boolean success) {
        int threshold = effectiveThreshold(state);
        CircuitBreakerState current = new CircuitBreakerState(
                state.isCircuitBreakerOpen(), state.getCircuitBreakerFailures(), threshold);
        CircuitBreakerState next = success ? current.afterSuccess() : current.afterFailure();
        if (next.open() && !current.open()) {
            log.warn("Circuit breaker opened for {} ({} failures, threshold {})", node, next.failureCount(), threshold);
        }
        return next;
    }

    public List<RoutingDecision> getRoutingHistory() {
        return List.copyOf(history);
    }

    public void clearRoutingHistory() {
        history.clear();
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

    private int effectiveMaxRetries(WorkflowRoutingState state) {
        Integer v = state.getMaxRetries();
        return v != null ? RoutingDefaults.requireMaxRetries("max_retries", v) : maxRetries;
    }

    private double effectiveBackoffMultiplier(WorkflowRoutingState state) {
        Double v = state.getBackoffMultiplier();
        return v != null ? RoutingDefaults.requireBackoffMultiplier("backoff_multiplier", v) : backoffMultiplier;
    }

    private int effectiveThreshold(WorkflowRoutingState state) {
        Integer v = state.getCircuitBreakerThreshold();
        return v != null ? RoutingDefaults.requireThreshold("circuit_breaker_threshold", v) : circuitBreakerThreshold;
    }

    private RoutingDecision record(RoutingDecision decision) {
        log.debug("Routing decision: next={} strategy={} reason={}",
                decision.nextNode(), decision.strategy().toValue(), decision.reason());
        if (recordHistory) {
            history.add(decision);
        }
        return decision;
    }
}
