package com.keystone.task;

/** The queue rejected a cancel request (unknown task or already finished). */
public final class CancellationFailureException extends RuntimeException {

    private final String taskId;

    public CancellationFailureException(String taskId) {
        super("Cancellation rejected for task " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
