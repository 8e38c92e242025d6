package com.keystone.pipeline;

import com.keystone.task.TaskStatus;

/** The task found ready by {@link WorkflowAggregator#waitForAny}. */
public record FirstCompleted(String taskId, TaskStatus status) {
}
