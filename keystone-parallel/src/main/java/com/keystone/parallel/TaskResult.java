package com.keystone.parallel;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one {@link ParallelTask}. A failed task has a null {@code result} and a non-null {@code error}.
 */
public record TaskResult<T>(
        String taskId,
        Status status,
        T result,
        String error,
        Instant startTime,
        Instant endTime
) {
    public enum Status {
        SUCCESS,
        FAILED
    }

    public static <T> TaskResult<T> success(String taskId, T result, Instant start, Instant end) {
        return new TaskResult<>(taskId, Status.SUCCESS, result, null, start, end);
    }

    public static <T> TaskResult<T> failed(String taskId, String error, Instant start, Instant end) {
        return new TaskResult<>(taskId, Status.FAILED, null, error, start, end);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /** Wall time between start and end; null when either is missing. */
    public Duration duration() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return Duration.between(startTime, endTime);
    }
}
