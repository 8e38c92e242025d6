package com.keystone.task;

import java.time.Duration;

/** Deadline exceeded in a wait or monitor call. */
public final class TaskTimeoutException extends RuntimeException {

    private final Duration timeout;

    public TaskTimeoutException(String message, Duration timeout) {
        super(message);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
