package com.keystone.pipeline;

import com.keystone.config.KeystoneConfig;
import com.keystone.config.SimulationCatalog;
import com.keystone.task.TaskQueue;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything the task client and workflow aggregator share: the queue, polling cadence, time
 * sources, meters and the simulation catalog. Built once per process and passed to both;
 * {@link #close()} drops tracked task handles and, when this context created the meter registry, closes it.
 */
public final class PipelineContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineContext.class);

    private final TaskQueue queue;
    private final Duration pollInterval;
    private final Duration defaultTimeout;
    private final Sleeper sleeper;
    private final Ticker ticker;
    private final PipelineMetrics metrics;
    private final SimulationCatalog simulationCatalog;
    private final boolean ownsRegistry;

    private PipelineContext(Builder b) {
        this.queue = Objects.requireNonNull(b.queue, "queue");
        this.pollInterval = b.pollInterval;
        this.defaultTimeout = b.defaultTimeout;
        this.sleeper = b.sleeper;
        this.ticker = b.ticker;
        this.ownsRegistry = b.meterRegistry == null;
        this.metrics = new PipelineMetrics(b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry());
        this.simulationCatalog = b.simulationCatalog;
    }

    public static Builder builder(TaskQueue queue) {
        return new Builder(queue);
    }

    /** Context with poll interval and default task timeout taken from {@code config}. */
    public static PipelineContext fromConfig(KeystoneConfig config, TaskQueue queue, SimulationCatalog catalog) {
        return builder(queue)
                .pollInterval(config.getPollInterval())
                .defaultTimeout(config.getTaskTimeout())
                .simulationCatalog(catalog)
                .build();
    }

    public TaskQueue getQueue() {
        return queue;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    /** Timeout used by waits that are not given one explicitly (e.g. sequential workflows); null = unbounded. */
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public Sleeper getSleeper() {
        return sleeper;
    }

    public Ticker getTicker() {
        return ticker;
    }

    public PipelineMetrics getMetrics() {
        return metrics;
    }

    public SimulationCatalog getSimulationCatalog() {
        return simulationCatalog;
    }

    @Override
    public void close() {
        queue.clearTrackedTasks();
        if (ownsRegistry) {
            metrics.getRegistry().close();
        }
        log.debug("Pipeline context closed");
    }

    public static final class Builder {
        private final TaskQueue queue;
        private Duration pollInterval = Duration.ofSeconds(2);
        private Duration defaultTimeout;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Ticker ticker = Ticker.SYSTEM;
        private MeterRegistry meterRegistry;
        private SimulationCatalog simulationCatalog = SimulationCatalog.empty();

        private Builder(TaskQueue queue) {
            this.queue = queue;
        }

        public Builder pollInterval(Duration pollInterval) {
            Objects.requireNonNull(pollInterval, "pollInterval");
            if (pollInterval.isNegative()) {
                throw new IllegalArgumentException("pollInterval must not be negative");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder ticker(Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker, "ticker");
            return this;
        }

        /** Registry for client meters; when unset the context creates and owns a {@link SimpleMeterRegistry}. */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder simulationCatalog(SimulationCatalog simulationCatalog) {
            this.simulationCatalog = simulationCatalog != null ? simulationCatalog : SimulationCatalog.empty();
            return this;
        }

        public PipelineContext build() {
            return new PipelineContext(this);
        }
    }
}
