package com.keystone.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;

/**
 * The single status shape returned by every client method: {@code state} is the discriminant;
 * {@code ready} is true for terminal states; {@code successful} is null until ready. {@code result}
 * is whatever the worker reported once the task is ready, for failed and cancelled tasks too.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatus(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("state") TaskState state,
        @JsonProperty("ready") boolean ready,
        @JsonProperty("successful") Boolean successful,
        @JsonProperty("progress") Integer progress,
        @JsonProperty("tool") String tool,
        @JsonProperty("script") String script,
        @JsonProperty("result") Map<String, Object> result,
        @JsonProperty("error") String error
) {
    public TaskStatus {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(state, "state");
    }

    /** Normalizes a raw poll; {@code ready} and {@code successful} are derived from the state. */
    public static TaskStatus from(String taskId, TaskPoll poll) {
        TaskState state = poll.state();
        boolean ready = state.isTerminal();
        Boolean successful = ready ? state == TaskState.SUCCESS : null;
        TaskSpec spec = poll.spec();
        return new TaskStatus(taskId, state, ready, successful, poll.progress(),
                spec != null ? spec.tool() : null,
                spec != null ? spec.script() : null,
                ready ? poll.result() : null,
                poll.error());
    }

    /** True when the task ended in {@link TaskState#FAILURE}, {@link TaskState#TIMEOUT} or {@link TaskState#CANCELLED}. */
    public boolean isFailed() {
        return ready && state != TaskState.SUCCESS;
    }

    /** {@code result.duration_seconds} as a number, or 0 when missing or unparseable. */
    public double durationSeconds() {
        if (result == null) return 0.0;
        Object value = result.get("duration_seconds");
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }
}
