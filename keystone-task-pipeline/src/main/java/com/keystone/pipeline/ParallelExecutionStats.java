package com.keystone.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Timing summary of a task set. Durations (seconds) cover successfully completed tasks only;
 * {@code speedup = totalDuration / maxDuration}, {@code efficiency = speedup / completed}.
 * With no completed task, durations are 0, speedup is 1 and efficiency 0.
 */
public record ParallelExecutionStats(
        @JsonProperty("total") int total,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("running") int running,
        @JsonProperty("pending") int pending,
        @JsonProperty("total_duration") double totalDuration,
        @JsonProperty("avg_duration") double avgDuration,
        @JsonProperty("max_duration") double maxDuration,
        @JsonProperty("speedup") double speedup,
        @JsonProperty("efficiency") double efficiency
) {
}
