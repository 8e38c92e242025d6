package com.keystone.task;

/**
 * Contract of the external queue and worker pool. Implementations may use any transport.
 * {@link #poll} must be a pure read: repeated calls with no intervening change return equal answers.
 */
public interface TaskQueue {

    /**
     * Enqueues one task and returns its opaque id without waiting for execution.
     *
     * @throws SubmissionException when the backend rejects the task
     */
    String submit(TaskSpec spec);

    /**
     * Current state of a task.
     *
     * @throws IllegalArgumentException when the id is unknown to the backend
     */
    TaskPoll poll(String taskId);

    /**
     * Requests cancellation. Returns whether the request was accepted, not whether the work stopped.
     */
    boolean cancel(String taskId);

    default QueueHealth healthCheck() {
        return QueueHealth.up(getClass().getSimpleName());
    }

    /** Drops locally cached handles for submitted tasks. Remote state is untouched. */
    default void clearTrackedTasks() {
    }
}
