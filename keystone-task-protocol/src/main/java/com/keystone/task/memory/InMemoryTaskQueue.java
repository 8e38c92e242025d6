package com.keystone.task.memory;

import com.keystone.task.TaskPoll;
import com.keystone.task.TaskQueue;
import com.keystone.task.TaskSpec;
import com.keystone.task.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * In-memory {@link TaskQueue} for local runs and tests. Nothing executes here: the owner plays the
 * worker through {@link #markRunning}, {@link #complete}, {@link #fail} and {@link #timeOut}.
 * Once a task is terminal any further transition throws {@link IllegalStateException}.
 */
public final class InMemoryTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskQueue.class);

    private final Map<String, TaskPoll> tasks = new ConcurrentHashMap<>();
    private final List<String> submissionOrder = Collections.synchronizedList(new ArrayList<>());
    private volatile BiConsumer<String, TaskSpec> submitListener = (id, spec) -> { };

    /** Called after every submission with the new id; e.g. to complete tasks immediately in tests. */
    public void setSubmitListener(BiConsumer<String, TaskSpec> listener) {
        this.submitListener = listener != null ? listener : (id, spec) -> { };
    }

    @Override
    public String submit(TaskSpec spec) {
        String taskId = UUID.randomUUID().toString();
        tasks.put(taskId, new TaskPoll(TaskState.PENDING, null, null, null, spec));
        submissionOrder.add(taskId);
        log.debug("Queued task {} ({}/{})", taskId, spec.tool(), spec.script());
        submitListener.accept(taskId, spec);
        return taskId;
    }

    @Override
    public TaskPoll poll(String taskId) {
        TaskPoll poll = tasks.get(taskId);
        if (poll == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return poll;
    }

    @Override
    public boolean cancel(String taskId) {
        boolean[] accepted = {false};
        tasks.computeIfPresent(taskId, (id, current) -> {
            if (current.state().isTerminal()) {
                return current;
            }
            accepted[0] = true;
            return new TaskPoll(TaskState.CANCELLED, current.progress(), null, "Cancelled by request", current.spec());
        });
        return accepted[0];
    }

    public void markRunning(String taskId, Integer progress) {
        transition(taskId, TaskState.RUNNING, progress, null, null);
    }

    public void complete(String taskId, Map<String, Object> result) {
        transition(taskId, TaskState.SUCCESS, 100, result, null);
    }

    public void fail(String taskId, String error) {
        transition(taskId, TaskState.FAILURE, null, null, error);
    }

    public void timeOut(String taskId) {
        transition(taskId, TaskState.TIMEOUT, null, null, "Task exceeded its time limit");
    }

    /** Ids in submission order. */
    public List<String> submittedIds() {
        synchronized (submissionOrder) {
            return List.copyOf(submissionOrder);
        }
    }

    public TaskSpec specOf(String taskId) {
        return poll(taskId).spec();
    }

    private void transition(String taskId, TaskState next, Integer progress, Map<String, Object> result, String error) {
        TaskPoll updated = tasks.computeIfPresent(taskId, (id, current) -> {
            if (current.state().isTerminal()) {
                throw new IllegalStateException("Task " + id + " is already " + current.state() + "; cannot move to " + next);
            }
            Integer p = progress != null ? progress : current.progress();
            return new TaskPoll(next, p, result, error, current.spec());
        });
        if (updated == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
    }
}
