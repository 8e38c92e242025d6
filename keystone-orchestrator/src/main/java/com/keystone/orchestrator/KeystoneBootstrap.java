package com.keystone.orchestrator;

import com.keystone.config.ConfigurationLoader;
import com.keystone.config.KeystoneConfig;
import com.keystone.config.KeystoneSettings;
import com.keystone.parallel.BatchProcessor;
import com.keystone.parallel.PoolKind;
import com.keystone.pipeline.PipelineContext;
import com.keystone.pipeline.TaskLifecycleClient;
import com.keystone.pipeline.WorkflowAggregator;
import com.keystone.queue.temporal.TemporalTaskQueue;
import com.keystone.routing.WorkflowRouter;
import com.keystone.routing.metrics.CircuitBreakerRegistry;
import com.keystone.routing.metrics.ExecutionMetricsTable;
import com.keystone.task.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires configuration, the task queue, client, aggregator, router, the shared metrics and
 * circuit breaker tables, and a local batch processor sized by {@code KEYSTONE_EXECUTOR_WORKERS}.
 * {@link #close()} releases the pipeline context.
 */
public final class KeystoneBootstrap implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KeystoneBootstrap.class);

    private final KeystoneConfig config;
    private final KeystoneSettings settings;
    private final PipelineContext context;
    private final TaskLifecycleClient client;
    private final WorkflowAggregator aggregator;
    private final WorkflowRouter router;
    private final ExecutionMetricsTable executionMetrics;
    private final CircuitBreakerRegistry circuitBreakers;
    private final BatchProcessor batchProcessor;

    private KeystoneBootstrap(KeystoneConfig config, KeystoneSettings settings, PipelineContext context) {
        this.config = config;
        this.settings = settings;
        this.context = context;
        this.client = new TaskLifecycleClient(context);
        this.aggregator = new WorkflowAggregator(client);
        this.router = new WorkflowRouter(settings.getRouting());
        this.executionMetrics = new ExecutionMetricsTable();
        this.circuitBreakers = new CircuitBreakerRegistry(settings.getRouting().getCircuitBreakerThreshold());
        this.batchProcessor = new BatchProcessor(config.getExecutorWorkers(), PoolKind.FIXED_THREADS);
    }

    /** Configuration from the environment, settings from the config dir, tasks on Temporal. */
    public static KeystoneBootstrap initialize() {
        log.info("Bootstrap: loading configuration from environment");
        KeystoneConfig config = KeystoneConfig.fromEnvironment();
        return create(config, TemporalTaskQueue.connect(config));
    }

    public static KeystoneBootstrap create(KeystoneConfig config, TaskQueue queue) {
        KeystoneSettings settings = new ConfigurationLoader(config.getConfigDirPath()).load();
        return create(config, settings, PipelineContext.fromConfig(config, queue, settings.getSimulations()));
    }

    public static KeystoneBootstrap create(KeystoneConfig config, KeystoneSettings settings, PipelineContext context) {
        log.info("Bootstrap: settings version={}, {} simulation tools, maxRetries={}, circuitBreakerThreshold={}, executorWorkers={}",
                settings.getVersion(), settings.getSimulations().size(),
                settings.getRouting().getMaxRetries(), settings.getRouting().getCircuitBreakerThreshold(),
                config.getExecutorWorkers());
        return new KeystoneBootstrap(config, settings, context);
    }

    public RoutedStepRunner newStepRunner() {
        return new RoutedStepRunner(client, router, executionMetrics, circuitBreakers);
    }

    public KeystoneConfig getConfig() {
        return config;
    }

    public KeystoneSettings getSettings() {
        return settings;
    }

    public TaskLifecycleClient getClient() {
        return client;
    }

    public WorkflowAggregator getAggregator() {
        return aggregator;
    }

    public WorkflowRouter getRouter() {
        return router;
    }

    public ExecutionMetricsTable getExecutionMetrics() {
        return executionMetrics;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return circuitBreakers;
    }

    /** Local pool for fan-out that does not go through the queue; each call opens and closes its own workers. */
    public BatchProcessor getBatchProcessor() {
        return batchProcessor;
    }

    @Override
    public void close() {
        context.close();
    }
}
