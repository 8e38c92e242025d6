package com.keystone.task;

/**
 * Thrown by blocking waits when the worker reported that the task did not succeed.
 * {@link #getState()} tells failure from cancellation.
 */
public final class RemoteExecutionException extends RuntimeException {

    private final String taskId;
    private final TaskState state;

    public RemoteExecutionException(String taskId, TaskState state, String error) {
        super("Task " + taskId + " ended in " + state + (error != null ? ": " + error : ""));
        this.taskId = taskId;
        this.state = state;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskState getState() {
        return state;
    }
}
