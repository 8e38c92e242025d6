package com.keystone.pipeline;

import com.keystone.task.ParameterGrid;
import com.keystone.task.SubmissionException;
import com.keystone.task.TaskOutcome;
import com.keystone.task.TaskSpec;
import com.keystone.task.TaskState;
import com.keystone.task.TaskStatus;
import com.keystone.task.TaskTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Many-task operations built on {@link TaskLifecycleClient}: workflow, batch and sweep submission,
 * aggregate status, and blocking wait-all / wait-any. Adds no remote primitives of its own.
 */
public final class WorkflowAggregator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAggregator.class);

    private final TaskLifecycleClient client;

    public WorkflowAggregator(TaskLifecycleClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Submits every task. When {@code sequential}, each task is awaited before the next is submitted
     * (only when there is more than one task); a task that fails or times out, or whose wait
     * itself fails, is logged and the workflow continues with the next one. An interrupt stops it.
     *
     * @throws SubmissionException when any spec is malformed; nothing is submitted in that case
     */
    public List<String> submitWorkflow(List<TaskSpec> tasks, boolean sequential) {
        requireValid(tasks);
        boolean waitEach = sequential && tasks.size() > 1;
        Duration timeout = client.getContext().getDefaultTimeout();
        List<String> ids = new ArrayList<>(tasks.size());
        for (TaskSpec spec : tasks) {
            String taskId = client.submitTask(spec);
            ids.add(taskId);
            if (waitEach) {
                awaitInSequence(taskId, timeout);
            }
        }
        log.info("Submitted workflow of {} tasks (sequential={})", ids.size(), sequential);
        return ids;
    }

    /** One status read per id folded into counts. */
    public WorkflowStatusView getWorkflowStatus(List<String> taskIds) {
        Map<String, TaskStatus> statuses = new LinkedHashMap<>();
        int completed = 0;
        int failed = 0;
        int running = 0;
        int pending = 0;
        for (String taskId : taskIds) {
            TaskStatus status = client.getTaskStatus(taskId);
            statuses.put(taskId, status);
            if (status.ready()) {
                if (Boolean.TRUE.equals(status.successful())) {
                    completed++;
                } else {
                    failed++;
                }
            } else if (status.state() == TaskState.RUNNING) {
                running++;
            } else {
                pending++;
            }
        }
        int total = taskIds.size();
        return new WorkflowStatusView(total, completed, failed, running, pending, completed + failed == total, statuses);
    }

    /**
     * Polls until no task is pending or running. A complete workflow may contain failed tasks.
     *
     * @param timeout      null waits indefinitely
     * @param callback     receives every polled view; may be null
     * @param pollInterval null uses the context interval
     * @throws TaskTimeoutException when {@code timeout} elapses first
     */
    public WorkflowStatusView waitForWorkflow(List<String> taskIds, Duration timeout,
                                              Consumer<WorkflowStatusView> callback, Duration pollInterval) {
        Duration interval = pollInterval != null ? pollInterval : client.getContext().getPollInterval();
        Deadline deadline = Deadline.after(client.getContext().getTicker(), timeout);
        while (true) {
            WorkflowStatusView view = getWorkflowStatus(taskIds);
            if (callback != null) {
                callback.accept(view);
            }
            if (view.allComplete()) {
                return view;
            }
            if (deadline.expired()) {
                throw new TaskTimeoutException("Workflow did not complete within " + timeout.toMillis() + " ms ("
                        + view.completed() + " completed, " + view.failed() + " failed of " + view.total() + ")", timeout);
            }
            client.pause(deadline.clamp(interval), "Workflow wait");
        }
    }

    /**
     * Submits {@code tasks} in chunks of {@code batchSize} (the last may be smaller), reporting after each chunk.
     *
     * @throws SubmissionException when {@code batchSize < 1} or any spec is malformed
     */
    public List<String> submitBatchWorkflow(List<TaskSpec> tasks, int batchSize, Consumer<BatchProgress> callback) {
        if (batchSize < 1) {
            throw new SubmissionException("batchSize must be >= 1, was " + batchSize);
        }
        requireValid(tasks);
        List<String> ids = new ArrayList<>(tasks.size());
        int batchNum = 0;
        for (int start = 0; start < tasks.size(); start += batchSize) {
            List<TaskSpec> chunk = tasks.subList(start, Math.min(start + batchSize, tasks.size()));
            for (TaskSpec spec : chunk) {
                ids.add(client.submitTask(spec));
            }
            batchNum++;
            log.info("Submitted batch {} ({} tasks, {}/{} total)", batchNum, chunk.size(), ids.size(), tasks.size());
            if (callback != null) {
                callback.accept(new BatchProgress(batchNum, chunk.size(), ids.size(), tasks.size()));
            }
        }
        return ids;
    }

    /**
     * Submits one {@code tool}/{@code script} task per combination of {@code grid}, last key varying fastest.
     *
     * @throws SubmissionException when tool or script is missing or a parameter has no values
     */
    public List<String> parameterSweep(String tool, String script, ParameterGrid grid, Consumer<SweepProgress> callback) {
        TaskSpec.of(tool, script).requireValid();
        List<Map<String, Object>> combinations = grid.combinations();
        log.info("Parameter sweep {}/{}: {} combinations", tool, script, combinations.size());
        List<String> ids = new ArrayList<>(combinations.size());
        for (int i = 0; i < combinations.size(); i++) {
            Map<String, Object> params = combinations.get(i);
            String taskId = client.submitTask(new TaskSpec(tool, script, params));
            ids.add(taskId);
            if (callback != null) {
                callback.accept(new SweepProgress(i, combinations.size(), taskId, params));
            }
        }
        return ids;
    }

    public List<String> parameterSweep(String tool, String script, Map<String, ? extends List<?>> grid,
                                       Consumer<SweepProgress> callback) {
        return parameterSweep(tool, script, ParameterGrid.of(grid), callback);
    }

    /**
     * Returns the first task found ready, checking ids in order each round.
     *
     * @throws IllegalArgumentException when {@code taskIds} is empty
     * @throws TaskTimeoutException     when none is ready before {@code timeout}
     */
    public FirstCompleted waitForAny(List<String> taskIds, Duration timeout, Duration pollInterval) {
        if (taskIds.isEmpty()) {
            throw new IllegalArgumentException("taskIds must not be empty");
        }
        Duration interval = pollInterval != null ? pollInterval : client.getContext().getPollInterval();
        Deadline deadline = Deadline.after(client.getContext().getTicker(), timeout);
        while (true) {
            for (String taskId : taskIds) {
                TaskStatus status = client.getTaskStatus(taskId);
                if (status.ready()) {
                    log.info("Task {} finished first ({})", taskId, status.state());
                    return new FirstCompleted(taskId, status);
                }
            }
            if (deadline.expired()) {
                throw new TaskTimeoutException("No task completed within " + timeout.toMillis() + " ms", timeout);
            }
            client.pause(deadline.clamp(interval), "Wait for any task");
        }
    }

    /** Durations come from each successful task's {@code duration_seconds} result field. Repeated ids count once. */
    public ParallelExecutionStats getParallelExecutionStats(List<String> taskIds) {
        WorkflowStatusView view = getWorkflowStatus(new ArrayList<>(new LinkedHashSet<>(taskIds)));
        double total = 0.0;
        double max = 0.0;
        for (TaskStatus status : view.tasks().values()) {
            if (Boolean.TRUE.equals(status.successful())) {
                double d = status.durationSeconds();
                total += d;
                max = Math.max(max, d);
            }
        }
        int completed = view.completed();
        double avg = completed > 0 ? total / completed : 0.0;
        double speedup = completed > 0 && max > 0.0 ? total / max : 1.0;
        double efficiency = completed > 0 ? speedup / completed : 0.0;
        return new ParallelExecutionStats(view.total(), completed, view.failed(), view.running(), view.pending(),
                total, avg, max, speedup, efficiency);
    }

    private void awaitInSequence(String taskId, Duration timeout) {
        try {
            TaskOutcome outcome = client.awaitTask(taskId, timeout);
            if (!outcome.isSuccess()) {
                log.warn("Task {} in sequential workflow did not succeed ({}): {}; continuing",
                        taskId, outcome.kind(), outcome.message());
            }
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.warn("Waiting on task {} in sequential workflow failed: {}; continuing", taskId, e.getMessage(), e);
        }
    }

    private static void requireValid(List<TaskSpec> tasks) {
        Objects.requireNonNull(tasks, "tasks");
        for (int i = 0; i < tasks.size(); i++) {
            TaskSpec spec = tasks.get(i);
            if (spec == null) {
                throw new SubmissionException("Task " + i + " is null");
            }
            spec.requireValid();
        }
    }
}
