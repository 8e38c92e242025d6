package com.keystone.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the Keystone orchestrator.
 * <p>
 * Queue backend: KEYSTONE_TEMPORAL_TARGET, KEYSTONE_TEMPORAL_NAMESPACE, KEYSTONE_TASK_QUEUE.
 * Polling: KEYSTONE_POLL_INTERVAL_MS, KEYSTONE_TASK_TIMEOUT_SECONDS, KEYSTONE_QUERY_PROGRESS.
 * Local pool: KEYSTONE_EXECUTOR_WORKERS. Settings file directory: KEYSTONE_CONFIG_DIR.
 */
public final class KeystoneConfig {

    static final String ENV_TEMPORAL_TARGET = "KEYSTONE_TEMPORAL_TARGET";
    static final String ENV_TEMPORAL_NAMESPACE = "KEYSTONE_TEMPORAL_NAMESPACE";
    static final String ENV_TASK_QUEUE = "KEYSTONE_TASK_QUEUE";
    static final String ENV_POLL_INTERVAL_MS = "KEYSTONE_POLL_INTERVAL_MS";
    static final String ENV_TASK_TIMEOUT_SECONDS = "KEYSTONE_TASK_TIMEOUT_SECONDS";
    static final String ENV_EXECUTOR_WORKERS = "KEYSTONE_EXECUTOR_WORKERS";
    static final String ENV_CONFIG_DIR = "KEYSTONE_CONFIG_DIR";
    static final String ENV_QUERY_PROGRESS = "KEYSTONE_QUERY_PROGRESS";

    private static final String DEFAULT_TEMPORAL_TARGET = "localhost:7233";
    private static final String DEFAULT_TEMPORAL_NAMESPACE = "default";
    private static final String DEFAULT_TASK_QUEUE = "keystone-simulations";
    private static final long DEFAULT_POLL_INTERVAL_MS = 2000L;
    private static final long DEFAULT_TASK_TIMEOUT_SECONDS = 3600L;
    private static final String DEFAULT_CONFIG_DIR = "config";

    private final String temporalTarget;
    private final String temporalNamespace;
    private final String taskQueue;
    private final Duration pollInterval;
    private final Duration taskTimeout;
    private final int executorWorkers;
    private final String configDir;
    private final boolean queryProgress;

    private KeystoneConfig(Builder b) {
        this.temporalTarget = b.temporalTarget;
        this.temporalNamespace = b.temporalNamespace;
        this.taskQueue = b.taskQueue;
        this.pollInterval = b.pollInterval;
        this.taskTimeout = b.taskTimeout;
        this.executorWorkers = b.executorWorkers;
        this.configDir = b.configDir;
        this.queryProgress = b.queryProgress;
    }

    public static KeystoneConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} over an explicit variable map. Unparseable numbers fall back to defaults. */
    public static KeystoneConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .temporalTarget(getEnv(env, ENV_TEMPORAL_TARGET, DEFAULT_TEMPORAL_TARGET))
                .temporalNamespace(getEnv(env, ENV_TEMPORAL_NAMESPACE, DEFAULT_TEMPORAL_NAMESPACE))
                .taskQueue(getEnv(env, ENV_TASK_QUEUE, DEFAULT_TASK_QUEUE))
                .pollInterval(Duration.ofMillis(parsePositiveLong(env.get(ENV_POLL_INTERVAL_MS), DEFAULT_POLL_INTERVAL_MS)))
                .taskTimeout(Duration.ofSeconds(parsePositiveLong(env.get(ENV_TASK_TIMEOUT_SECONDS), DEFAULT_TASK_TIMEOUT_SECONDS)))
                .executorWorkers((int) parsePositiveLong(env.get(ENV_EXECUTOR_WORKERS), defaultWorkers()))
                .configDir(getEnv(env, ENV_CONFIG_DIR, DEFAULT_CONFIG_DIR))
                .queryProgress(parseBoolean(env.get(ENV_QUERY_PROGRESS), false))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Temporal frontend address (host:port). Default {@code localhost:7233}. */
    public String getTemporalTarget() {
        return temporalTarget;
    }

    public String getTemporalNamespace() {
        return temporalNamespace;
    }

    /** Task queue the simulation workers poll. Default {@code keystone-simulations}. */
    public String getTaskQueue() {
        return taskQueue;
    }

    /** Interval between status polls while waiting on a task. Default 2s. */
    public Duration getPollInterval() {
        return pollInterval;
    }

    /** Default wait timeout for a single task (and execution timeout of submitted workflows). Default 1h. */
    public Duration getTaskTimeout() {
        return taskTimeout;
    }

    /** Local parallel executor pool size. Default: available processors. */
    public int getExecutorWorkers() {
        return executorWorkers;
    }

    public String getConfigDir() {
        return configDir;
    }

    public Path getConfigDirPath() {
        return Path.of(configDir);
    }

    /** Whether status polls also query the running workflow for its progress. Default false. */
    public boolean isQueryProgress() {
        return queryProgress;
    }

    private static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static long parsePositiveLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String temporalTarget = DEFAULT_TEMPORAL_TARGET;
        private String temporalNamespace = DEFAULT_TEMPORAL_NAMESPACE;
        private String taskQueue = DEFAULT_TASK_QUEUE;
        private Duration pollInterval = Duration.ofMillis(DEFAULT_POLL_INTERVAL_MS);
        private Duration taskTimeout = Duration.ofSeconds(DEFAULT_TASK_TIMEOUT_SECONDS);
        private int executorWorkers = defaultWorkers();
        private String configDir = DEFAULT_CONFIG_DIR;
        private boolean queryProgress;

        public Builder temporalTarget(String temporalTarget) {
            this.temporalTarget = temporalTarget != null ? temporalTarget : DEFAULT_TEMPORAL_TARGET;
            return this;
        }

        public Builder temporalNamespace(String temporalNamespace) {
            this.temporalNamespace = temporalNamespace != null ? temporalNamespace : DEFAULT_TEMPORAL_NAMESPACE;
            return this;
        }

        public Builder taskQueue(String taskQueue) {
            this.taskQueue = taskQueue != null ? taskQueue : DEFAULT_TASK_QUEUE;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
            return this;
        }

        public Builder taskTimeout(Duration taskTimeout) {
            this.taskTimeout = Objects.requireNonNull(taskTimeout, "taskTimeout");
            return this;
        }

        public Builder executorWorkers(int executorWorkers) {
            this.executorWorkers = executorWorkers;
            return this;
        }

        public Builder configDir(String configDir) {
            this.configDir = configDir != null ? configDir : DEFAULT_CONFIG_DIR;
            return this;
        }

        public Builder queryProgress(boolean queryProgress) {
            this.queryProgress = queryProgress;
            return this;
        }

        /**
         * @throws ConfigurationException when the poll interval or timeout is not positive, or workers is below 1
         */
        public KeystoneConfig build() {
            if (pollInterval.isNegative() || pollInterval.isZero()) {
                throw new ConfigurationException("pollInterval", "must be positive, was " + pollInterval);
            }
            if (taskTimeout.isNegative() || taskTimeout.isZero()) {
                throw new ConfigurationException("taskTimeout", "must be positive, was " + taskTimeout);
            }
            if (executorWorkers < 1) {
                throw new ConfigurationException("executorWorkers", "must be >= 1, was " + executorWorkers);
            }
            return new KeystoneConfig(this);
        }
    }
}
