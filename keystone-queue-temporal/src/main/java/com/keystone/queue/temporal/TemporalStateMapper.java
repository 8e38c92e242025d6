package com.keystone.queue.temporal;

import com.keystone.task.TaskState;
import io.temporal.api.enums.v1.WorkflowExecutionStatus;

/** Maps Temporal execution statuses onto task states. */
final class TemporalStateMapper {

    /** History length of a started execution no worker has picked up yet (started + task scheduled). */
    static final long START_EVENTS = 2L;

    private TemporalStateMapper() {
    }

    static TaskState toTaskState(WorkflowExecutionStatus status, long historyLength) {
        switch (status) {
            case WORKFLOW_EXECUTION_STATUS_RUNNING:
            case WORKFLOW_EXECUTION_STATUS_CONTINUED_AS_NEW:
                return historyLength <= START_EVENTS ? TaskState.PENDING : TaskState.RUNNING;
            case WORKFLOW_EXECUTION_STATUS_COMPLETED:
                return TaskState.SUCCESS;
            case WORKFLOW_EXECUTION_STATUS_FAILED:
                return TaskState.FAILURE;
            case WORKFLOW_EXECUTION_STATUS_TIMED_OUT:
                return TaskState.TIMEOUT;
            case WORKFLOW_EXECUTION_STATUS_CANCELED:
            case WORKFLOW_EXECUTION_STATUS_TERMINATED:
                return TaskState.CANCELLED;
            default:
                return TaskState.PENDING;
        }
    }
}
