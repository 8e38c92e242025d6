package com.keystone.pipeline;

import com.keystone.task.TaskState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Objects;

/**
 * Client activity meters: {@code keystone.task.submitted{tool}}, {@code keystone.task.finished{state}},
 * {@code keystone.task.cancel{accepted}} and the {@code keystone.task.wait} timer.
 */
public final class PipelineMetrics {

    static final String SUBMITTED = "keystone.task.submitted";
    static final String FINISHED = "keystone.task.finished";
    static final String CANCEL = "keystone.task.cancel";
    static final String WAIT = "keystone.task.wait";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public void taskSubmitted(String tool) {
        registry.counter(SUBMITTED, "tool", tool).increment();
    }

    public void taskFinished(TaskState state) {
        registry.counter(FINISHED, "state", state.name()).increment();
    }

    public void cancelRequested(boolean accepted) {
        registry.counter(CANCEL, "accepted", String.valueOf(accepted)).increment();
    }

    public void waited(Duration elapsed, String outcome) {
        Timer.builder(WAIT)
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
