package com.keystone.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeystoneConfigTest {

    @Test
    void fromEnvironment_emptyUsesDefaults() {
        KeystoneConfig config = KeystoneConfig.fromEnvironment(Map.of());

        assertEquals("localhost:7233", config.getTemporalTarget());
        assertEquals("default", config.getTemporalNamespace());
        assertEquals("keystone-simulations", config.getTaskQueue());
        assertEquals(Duration.ofSeconds(2), config.getPollInterval());
        assertEquals(Duration.ofHours(1), config.getTaskTimeout());
        assertTrue(config.getExecutorWorkers() >= 1);
        assertEquals("config", config.getConfigDir());
        assertFalse(config.isQueryProgress());
    }

    @Test
    void fromEnvironment_readsValues() {
        KeystoneConfig config = KeystoneConfig.fromEnvironment(Map.of(
                KeystoneConfig.ENV_TEMPORAL_TARGET, " temporal:7233 ",
                KeystoneConfig.ENV_TASK_QUEUE, "sims-gpu",
                KeystoneConfig.ENV_POLL_INTERVAL_MS, "250",
                KeystoneConfig.ENV_TASK_TIMEOUT_SECONDS, "60",
                KeystoneConfig.ENV_EXECUTOR_WORKERS, "3",
                KeystoneConfig.ENV_QUERY_PROGRESS, "true"));

        assertEquals("temporal:7233", config.getTemporalTarget());
        assertEquals("sims-gpu", config.getTaskQueue());
        assertEquals(Duration.ofMillis(250), config.getPollInterval());
        assertEquals(Duration.ofSeconds(60), config.getTaskTimeout());
        assertEquals(3, config.getExecutorWorkers());
        assertTrue(config.isQueryProgress());
    }

    @Test
    void fromEnvironment_unparseableNumbersFallBackToDefaults() {
        KeystoneConfig config = KeystoneConfig.fromEnvironment(Map.of(
                KeystoneConfig.ENV_POLL_INTERVAL_MS, "fast",
                KeystoneConfig.ENV_TASK_TIMEOUT_SECONDS, "-5"));

        assertEquals(Duration.ofSeconds(2), config.getPollInterval());
        assertEquals(Duration.ofHours(1), config.getTaskTimeout());
    }

    @Test
    void builder_rejectsNonPositiveValues() {
        assertThrows(ConfigurationException.class,
                () -> KeystoneConfig.builder().pollInterval(Duration.ZERO).build());
        assertThrows(ConfigurationException.class,
                () -> KeystoneConfig.builder().executorWorkers(0).build());
    }
}
