package com.keystone.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.task.TaskStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate view over a set of tasks, recomputed on every call.
 * {@code completed + failed + running + pending == total}; {@code allComplete} means nothing is
 * pending or running, not that every task succeeded.
 */
public record WorkflowStatusView(
        @JsonProperty("total") int total,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("running") int running,
        @JsonProperty("pending") int pending,
        @JsonProperty("all_complete") boolean allComplete,
        @JsonProperty("tasks") Map<String, TaskStatus> tasks
) {
    public WorkflowStatusView {
        tasks = tasks != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tasks)) : Map.of();
    }
}
