package com.keystone.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.routing.metrics.ExecutionMetrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only input of every routing call. Owned by the calling orchestrator; the router never
 * mutates it. Nullable retry and circuit breaker settings fall back to the router's defaults.
 * Use {@link #toBuilder()} to derive the next state.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkflowRoutingState {

    private final Map<String, NodeStatus> nodeStatus;
    private final Map<String, Map<String, Object>> nodeResults;
    private final List<Map<String, Object>> errors;
    private final ErrorSeverity errorSeverity;
    private final int retryCount;
    private final Integer maxRetries;
    private final Double backoffMultiplier;
    private final boolean circuitBreakerOpen;
    private final int circuitBreakerFailures;
    private final Integer circuitBreakerThreshold;
    private final Map<String, ExecutionMetrics> executionMetrics;
    private final Map<String, Object> workflowContext;
    private final Map<String, Object> userPreferences;
    private final Map<String, Double> resourceLimits;
    private final Map<String, Double> currentResourceUsage;

    @JsonCreator
    WorkflowRoutingState(
            @JsonProperty("node_status") Map<String, NodeStatus> nodeStatus,
            @JsonProperty("node_results") Map<String, Map<String, Object>> nodeResults,
            @JsonProperty("errors") List<Map<String, Object>> errors,
            @JsonProperty("error_severity") ErrorSeverity errorSeverity,
            @JsonProperty("retry_count") Integer retryCount,
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("backoff_multiplier") Double backoffMultiplier,
            @JsonProperty("circuit_breaker_open") Boolean circuitBreakerOpen,
            @JsonProperty("circuit_breaker_failures") Integer circuitBreakerFailures,
            @JsonProperty("circuit_breaker_threshold") Integer circuitBreakerThreshold,
            @JsonProperty("execution_metrics") Map<String, ExecutionMetrics> executionMetrics,
            @JsonProperty("workflow_context") Map<String, Object> workflowContext,
            @JsonProperty("user_preferences") Map<String, Object> userPreferences,
            @JsonProperty("resource_limits") Map<String, Double> resourceLimits,
            @JsonProperty("current_resource_usage") Map<String, Double> currentResourceUsage) {
        this.nodeStatus = copy(nodeStatus);
        this.nodeResults = copy(nodeResults);
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
        this.errorSeverity = errorSeverity != null ? errorSeverity : ErrorSeverity.LOW;
        this.retryCount = retryCount != null ? retryCount : 0;
        this.maxRetries = maxRetries;
        this.backoffMultiplier = backoffMultiplier;
        this.circuitBreakerOpen = circuitBreakerOpen != null && circuitBreakerOpen;
        this.circuitBreakerFailures = circuitBreakerFailures != null ? circuitBreakerFailures : 0;
        this.circuitBreakerThreshold = circuitBreakerThreshold;
        this.executionMetrics = copy(executionMetrics);
        this.workflowContext = copy(workflowContext);
        this.userPreferences = copy(userPreferences);
        this.resourceLimits = copy(resourceLimits);
        this.currentResourceUsage = copy(currentResourceUsage);
    }

    private static <K, V> Map<K, V> copy(Map<K, V> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }

    public static WorkflowRoutingState empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .nodeStatus(nodeStatus)
                .nodeResults(nodeResults)
                .errors(errors)
                .errorSeverity(errorSeverity)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .backoffMultiplier(backoffMultiplier)
                .circuitBreakerOpen(circuitBreakerOpen)
                .circuitBreakerFailures(circuitBreakerFailures)
                .circuitBreakerThreshold(circuitBreakerThreshold)
                .executionMetrics(executionMetrics)
                .workflowContext(workflowContext)
                .userPreferences(userPreferences)
                .resourceLimits(resourceLimits)
                .currentResourceUsage(currentResourceUsage);
    }

    /** Status of {@code node}, or null when nothing has been recorded for it. */
    public NodeStatus statusOf(String node) {
        return nodeStatus.get(node);
    }

    /** Result map of {@code node}; empty when absent. */
    public Map<String, Object> resultsOf(String node) {
        Map<String, Object> results = nodeResults.get(node);
        return results != null ? results : Map.of();
    }

    @JsonProperty("node_status")
    public Map<String, NodeStatus> getNodeStatus() {
        return nodeStatus;
    }

    @JsonProperty("node_results")
    public Map<String, Map<String, Object>> getNodeResults() {
        return nodeResults;
    }

    @JsonProperty("errors")
    public List<Map<String, Object>> getErrors() {
        return errors;
    }

    @JsonProperty("error_severity")
    public ErrorSeverity getErrorSeverity() {
        return errorSeverity;
    }

    @JsonProperty("retry_count")
    public int getRetryCount() {
        return retryCount;
    }

    @JsonProperty("max_retries")
    public Integer getMaxRetries() {
        return maxRetries;
    }

    @JsonProperty("backoff_multiplier")
    public Double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    @JsonProperty("circuit_breaker_open")
    public boolean isCircuitBreakerOpen() {
        return circuitBreakerOpen;
    }

    @JsonProperty("circuit_breaker_failures")
    public int getCircuitBreakerFailures() {
        return circuitBreakerFailures;
    }

    @JsonProperty("circuit_breaker_threshold")
    public Integer getCircuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    @JsonProperty("execution_metrics")
    public Map<String, ExecutionMetrics> getExecutionMetrics() {
        return executionMetrics;
    }

    @JsonProperty("workflow_context")
    public Map<String, Object> getWorkflowContext() {
        return workflowContext;
    }

    @JsonProperty("user_preferences")
    public Map<String, Object> getUserPreferences() {
        return userPreferences;
    }

    @JsonProperty("resource_limits")
    public Map<String, Double> getResourceLimits() {
        return resourceLimits;
    }

    @JsonProperty("current_resource_usage")
    public Map<String, Double> getCurrentResourceUsage() {
        return currentResourceUsage;
    }

    public static final class Builder {
        private final Map<String, NodeStatus> nodeStatus = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> nodeResults = new LinkedHashMap<>();
        private final List<Map<String, Object>> errors = new ArrayList<>();
        private ErrorSeverity errorSeverity = ErrorSeverity.LOW;
        private int retryCount;
        private Integer maxRetries;
        private Double backoffMultiplier;
        private boolean circuitBreakerOpen;
        private int circuitBreakerFailures;
        private Integer circuitBreakerThreshold;
        private final Map<String, ExecutionMetrics> executionMetrics = new LinkedHashMap<>();
        private final Map<String, Object> workflowContext = new LinkedHashMap<>();
        private final Map<String, Object> userPreferences = new LinkedHashMap<>();
        private final Map<String, Double> resourceLimits = new LinkedHashMap<>();
        private final Map<String, Double> currentResourceUsage = new LinkedHashMap<>();

        public Builder nodeStatus(Map<String, NodeStatus> statuses) {
            nodeStatus.clear();
            if (statuses != null) nodeStatus.putAll(statuses);
            return this;
        }

        public Builder nodeStatus(String node, NodeStatus status) {
            nodeStatus.put(node, status);
            return this;
        }

        public Builder nodeResults(Map<String, Map<String, Object>> results) {
            nodeResults.clear();
            if (results != null) nodeResults.putAll(results);
            return this;
        }

        public Builder nodeResult(String node, Map<String, Object> result) {
            nodeResults.put(node, result != null ? result : Map.of());
            return this;
        }

        public Builder errors(List<Map<String, Object>> list) {
            errors.clear();
            if (list != null) errors.addAll(list);
            return this;
        }

        public Builder addError(Map<String, Object> error) {
            errors.add(error);
            return this;
        }

        public Builder errorSeverity(ErrorSeverity errorSeverity) {
            this.errorSeverity = errorSeverity != null ? errorSeverity : ErrorSeverity.LOW;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(Integer maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffMultiplier(Double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder circuitBreakerOpen(boolean circuitBreakerOpen) {
            this.circuitBreakerOpen = circuitBreakerOpen;
            return this;
        }

        public Builder circuitBreakerFailures(int circuitBreakerFailures) {
            this.circuitBreakerFailures = circuitBreakerFailures;
            return this;
        }

        public Builder circuitBreakerThreshold(Integer circuitBreakerThreshold) {
            this.circuitBreakerThreshold = circuitBreakerThreshold;
            return this;
        }

        public Builder executionMetrics(Map<String, ExecutionMetrics> metrics) {
            executionMetrics.clear();
            if (metrics != null) executionMetrics.putAll(metrics);
            return this;
        }

        public Builder executionMetrics(String node, ExecutionMetrics metrics) {
            executionMetrics.put(node, metrics);
            return this;
        }

        public Builder workflowContext(Map<String, Object> context) {
            workflowContext.clear();
            if (context != null) workflowContext.putAll(context);
            return this;
        }

        public Builder workflowContext(String key, Object value) {
            workflowContext.put(key, value);
            return this;
        }

        public Builder userPreferences(Map<String, Object> preferences) {
            userPreferences.clear();
            if (preferences != null) userPreferences.putAll(preferences);
            return this;
        }

        public Builder resourceLimits(Map<String, Double> limits) {
            resourceLimits.clear();
            if (limits != null) resourceLimits.putAll(limits);
            return this;
        }

        public Builder resourceLimit(String resource, double limit) {
            resourceLimits.put(resource, limit);
            return this;
        }

        public Builder currentResourceUsage(Map<String, Double> usage) {
            currentResourceUsage.clear();
            if (usage != null) currentResourceUsage.putAll(usage);
            return this;
        }

        public Builder resourceUsage(String resource, double usage) {
            currentResourceUsage.put(resource, usage);
            return this;
        }

        public WorkflowRoutingState build() {
            return new WorkflowRoutingState(nodeStatus, nodeResults, errors, errorSeverity, retryCount,
                    maxRetries, backoffMultiplier, circuitBreakerOpen, circuitBreakerFailures,
                    circuitBreakerThreshold, executionMetrics, workflowContext, userPreferences,
                    resourceLimits, currentResourceUsage);
        }
    }
}
