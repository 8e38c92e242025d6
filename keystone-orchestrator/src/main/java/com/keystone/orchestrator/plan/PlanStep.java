package com.keystone.orchestrator.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.task.TaskSpec;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a {@link WorkflowPlan}: a simulation task plus its routing edges.
 *
 * @param next           step run after success; null means the following step in the plan
 * @param onError        step run on failure, timeout or open circuit; null ends the run
 * @param retry          whether failed runs are retried with backoff before falling back
 * @param timeoutSeconds wait limit for the task; null uses the configured task timeout
 */
public record PlanStep(
        @JsonProperty("id") String id,
        @JsonProperty("tool") String tool,
        @JsonProperty("script") String script,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("next") String next,
        @JsonProperty("on_error") String onError,
        @JsonProperty("retry") boolean retry,
        @JsonProperty("timeout_seconds") Long timeoutSeconds
) {
    public PlanStep {
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
    }

    public TaskSpec toSpec() {
        return new TaskSpec(tool, script, params);
    }

    public Duration timeout(Duration fallback) {
        return timeoutSeconds != null ? Duration.ofSeconds(timeoutSeconds) : fallback;
    }
}
