package com.keystone.task;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Non-throwing result of waiting on a task. {@link Kind} is the discriminant; {@link #status()} is
 * the last observed status (null only for {@link Kind#TIMED_OUT} before the first poll).
 */
public final class TaskOutcome {

    public enum Kind {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        CANCELLED
    }

    private final Kind kind;
    private final String taskId;
    private final TaskStatus status;
    private final String message;

    private TaskOutcome(Kind kind, String taskId, TaskStatus status, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.taskId = Objects.requireNonNull(taskId, "taskId");
        this.status = status;
        this.message = message;
    }

    /** Maps a ready status onto an outcome. A remote TIMEOUT state is {@link Kind#FAILED}; only the wait deadline is TIMED_OUT. */
    public static TaskOutcome fromReadyStatus(TaskStatus status) {
        if (!status.ready()) {
            throw new IllegalArgumentException("Task " + status.taskId() + " is not ready (" + status.state() + ")");
        }
        return switch (status.state()) {
            case SUCCESS -> new TaskOutcome(Kind.SUCCEEDED, status.taskId(), status, null);
            case CANCELLED -> new TaskOutcome(Kind.CANCELLED, status.taskId(), status, status.error());
            case FAILURE, TIMEOUT -> new TaskOutcome(Kind.FAILED, status.taskId(), status,
                    status.error() != null ? status.error() : status.state().name());
            case PENDING, RUNNING -> throw new IllegalStateException("unreachable");
        };
    }

    public static TaskOutcome timedOut(String taskId, TaskStatus lastStatus, Duration timeout) {
        return new TaskOutcome(Kind.TIMED_OUT, taskId, lastStatus,
                "Task " + taskId + " did not complete within " + timeout.toMillis() + " ms");
    }

    public Kind kind() {
        return kind;
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus status() {
        return status;
    }

    /** Error text for non-success kinds; null when succeeded. */
    public String message() {
        return message;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCEEDED;
    }

    /** Result map of a succeeded task; empty for any other kind. */
    public Map<String, Object> result() {
        if (kind != Kind.SUCCEEDED || status == null || status.result() == null) {
            return Map.of();
        }
        return status.result();
    }

    /**
     * Result of a succeeded task, or the typed error for the other kinds.
     *
     * @throws TaskTimeoutException      when TIMED_OUT
     * @throws RemoteExecutionException when FAILED or CANCELLED
     */
    public Map<String, Object> getOrThrow(Duration timeout) {
        return switch (kind) {
            case SUCCEEDED -> result();
            case TIMED_OUT -> throw new TaskTimeoutException(message, timeout);
            case FAILED, CANCELLED -> throw new RemoteExecutionException(taskId, status.state(), message);
        };
    }

    @Override
    public String toString() {
        return "TaskOutcome{" + kind + ", taskId=" + taskId + (message != null ? ", message=" + message : "") + "}";
    }
}
