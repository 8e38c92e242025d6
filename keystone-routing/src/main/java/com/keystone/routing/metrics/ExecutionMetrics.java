package com.keystone.routing.metrics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Running statistics for one node. {@code successRate == (executionCount - failureCount) / executionCount * 100}
 * when {@code executionCount > 0}, else 100. Failures do not move the average execution time.
 */
public record ExecutionMetrics(
        @JsonProperty("execution_count") int executionCount,
        @JsonProperty("failure_count") int failureCount,
        @JsonProperty("avg_execution_time") double avgExecutionTime,
        @JsonProperty("last_execution_time") Instant lastExecutionTime,
        @JsonProperty("success_rate") double successRate
) {
    @JsonCreator
    public ExecutionMetrics {
        if (executionCount < 0 || failureCount < 0 || failureCount > executionCount) {
            throw new IllegalArgumentException("Invalid counts: executions=" + executionCount + ", failures=" + failureCount);
        }
        successRate = successRate(executionCount, failureCount);
    }

    /** No executions yet: success rate 100, average 0. */
    public static ExecutionMetrics initial() {
        return new ExecutionMetrics(0, 0, 0.0, null, 100.0);
    }

    public ExecutionMetrics afterSuccess(Duration elapsed) {
        return afterSuccess(elapsed.toNanos() / 1_000_000_000.0, Instant.now());
    }

    /** Folds one successful execution of {@code seconds} into the running mean. */
    public ExecutionMetrics afterSuccess(double seconds, Instant at) {
        int count = executionCount + 1;
        double avg = (avgExecutionTime * (count - 1) + seconds) / count;
        return new ExecutionMetrics(count, failureCount, avg, at, 0.0);
    }

    public ExecutionMetrics afterFailure() {
        return afterFailure(Instant.now());
    }

    public ExecutionMetrics afterFailure(Instant at) {
        return new ExecutionMetrics(executionCount + 1, failureCount + 1, avgExecutionTime, at, 0.0);
    }

    private static double successRate(int executions, int failures) {
        if (executions == 0) return 100.0;
        return (double) (executions - failures) / executions * 100.0;
    }
}
