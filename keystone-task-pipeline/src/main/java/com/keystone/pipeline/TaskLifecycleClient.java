package com.keystone.pipeline;

import com.keystone.config.SimulationCatalog;
import com.keystone.task.CancellationFailureException;
import com.keystone.task.QueueHealth;
import com.keystone.task.SubmissionException;
import com.keystone.task.TaskOutcome;
import com.keystone.task.TaskQueue;
import com.keystone.task.TaskSpec;
import com.keystone.task.TaskStatus;
import com.keystone.task.TaskTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Submits, observes and cancels individual tasks on the {@link TaskQueue} held by a
 * {@link PipelineContext}. Status reads are side-effect free and may be issued at any rate;
 * blocking calls poll on the calling thread with the context's sleeper.
 */
public final class TaskLifecycleClient {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycleClient.class);

    private final PipelineContext context;

    public TaskLifecycleClient(PipelineContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public PipelineContext getContext() {
        return context;
    }

    /**
     * Enqueues one simulation and returns its id without waiting.
     *
     * @throws SubmissionException when tool or script is missing, or the queue rejects the task
     */
    public String submitTask(String tool, String script, Map<String, Object> params) {
        return submitTask(new TaskSpec(tool, script, params));
    }

    public String submitTask(TaskSpec spec) {
        Objects.requireNonNull(spec, "spec").requireValid();
        String taskId;
        try {
            taskId = context.getQueue().submit(spec);
        } catch (SubmissionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SubmissionException("Failed to submit " + spec.tool() + "/" + spec.script() + ": " + e.getMessage(), e);
        }
        context.getMetrics().taskSubmitted(spec.tool());
        log.info("Submitted task {} ({}/{})", taskId, spec.tool(), spec.script());
        return taskId;
    }

    /** Current normalized status. Pure read. */
    public TaskStatus getTaskStatus(String taskId) {
        return TaskStatus.from(taskId, context.getQueue().poll(taskId));
    }

    /**
     * Polls until the task is ready, passing every snapshot to {@code callback}; the last
     * callback is the ready status, which is also returned.
     *
     * @param timeout null waits indefinitely
     * @throws TaskTimeoutException when {@code timeout} elapses first
     */
    public TaskStatus monitorTask(String taskId, Consumer<TaskStatus> callback, Duration pollInterval, Duration timeout) {
        Duration interval = pollInterval != null ? pollInterval : context.getPollInterval();
        Deadline deadline = Deadline.after(context.getTicker(), timeout);
        while (true) {
            TaskStatus status = getTaskStatus(taskId);
            if (callback != null) {
                callback.accept(status);
            }
            if (status.ready()) {
                return status;
            }
            if (deadline.expired()) {
                throw new TaskTimeoutException("Task " + taskId + " not ready within " + timeout.toMillis() + " ms", timeout);
            }
            pause(deadline.clamp(interval), "Task monitoring");
        }
    }

    public TaskStatus monitorTask(String taskId, Consumer<TaskStatus> callback, Duration pollInterval) {
        return monitorTask(taskId, callback, pollInterval, null);
    }

    /**
     * Waits for the task and reports how it ended without throwing for remote failure or timeout.
     *
     * @param timeout null waits indefinitely
     */
    public TaskOutcome awaitTask(String taskId, Duration timeout) {
        Ticker ticker = context.getTicker();
        long started = ticker.nanoTime();
        Deadline deadline = Deadline.after(ticker, timeout);
        while (true) {
            TaskStatus status = getTaskStatus(taskId);
            if (status.ready()) {
                TaskOutcome outcome = TaskOutcome.fromReadyStatus(status);
                context.getMetrics().taskFinished(status.state());
                context.getMetrics().waited(Duration.ofNanos(ticker.nanoTime() - started), outcome.kind().name());
                log.debug("Task {} finished: {}", taskId, outcome.kind());
                return outcome;
            }
            if (deadline.expired()) {
                context.getMetrics().waited(Duration.ofNanos(ticker.nanoTime() - started), TaskOutcome.Kind.TIMED_OUT.name());
                return TaskOutcome.timedOut(taskId, status, timeout);
            }
            pause(deadline.clamp(context.getPollInterval()), "Task wait");
        }
    }

    /**
     * Blocks until the task finishes and returns its result map.
     *
     * @throws TaskTimeoutException                          when {@code timeout} elapses first
     * @throws com.keystone.task.RemoteExecutionException when the task failed, timed out remotely or was cancelled
     */
    public Map<String, Object> waitForTask(String taskId, Duration timeout) {
        return awaitTask(taskId, timeout).getOrThrow(timeout);
    }

    /**
     * Requests cancellation. True means the queue accepted the request; the work may still be running.
     */
    public boolean cancelTask(String taskId) {
        boolean accepted;
        try {
            accepted = context.getQueue().cancel(taskId);
        } catch (RuntimeException e) {
            log.warn("Cancel request for task {} failed: {}", taskId, e.getMessage(), e);
            accepted = false;
        }
        context.getMetrics().cancelRequested(accepted);
        if (accepted) {
            log.info("Cancellation requested for task {}", taskId);
        } else {
            log.warn("Cancellation rejected for task {}", taskId);
        }
        return accepted;
    }

    /**
     * @throws CancellationFailureException when the queue rejects the request
     */
    public void requireCancelled(String taskId) {
        if (!cancelTask(taskId)) {
            throw new CancellationFailureException(taskId);
        }
    }

    public QueueHealth healthCheck() {
        QueueHealth health = context.getQueue().healthCheck();
        if (!health.healthy()) {
            log.warn("Queue unhealthy: {}", health.detail());
        }
        return health;
    }

    public SimulationCatalog listAvailableSimulations() {
        return context.getSimulationCatalog();
    }

    /** Drops locally tracked task handles; results stay retrievable by id. */
    public void cleanup() {
        context.getQueue().clearTrackedTasks();
    }

    void pause(Duration duration, String operation) {
        try {
            context.getSleeper().sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(operation + " interrupted", e);
        }
    }
}
