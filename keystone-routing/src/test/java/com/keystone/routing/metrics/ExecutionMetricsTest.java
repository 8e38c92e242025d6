package com.keystone.routing.metrics;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExecutionMetricsTest {

    @Test
    void initialHasFullSuccessRate() {
        ExecutionMetrics m = ExecutionMetrics.initial();
        assertEquals(100.0, m.successRate());
        assertEquals(0, m.executionCount());
        assertNull(m.lastExecutionTime());
    }

    @Test
    void runningMeanAndSuccessRate() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        ExecutionMetrics m = ExecutionMetrics.initial()
                .afterSuccess(10.0, at)
                .afterSuccess(20.0, at)
                .afterFailure(at);

        assertEquals(3, m.executionCount());
        assertEquals(1, m.failureCount());
        assertEquals(15.0, m.avgExecutionTime(), 1e-9);
        assertEquals(200.0 / 3.0, m.successRate(), 1e-9);
        assertEquals(at, m.lastExecutionTime());
    }

    @Test
    void tableSerializesConcurrentUpdatesPerNode() throws Exception {
        ExecutionMetricsTable table = new ExecutionMetricsTable();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                final boolean fail = i % 4 == 0;
                futures.add(pool.submit(() -> {
                    if (fail) {
                        table.recordFailure("simulate");
                    } else {
                        table.recordSuccess("simulate", Duration.ofSeconds(2));
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        ExecutionMetrics m = table.get("simulate").orElseThrow();
        assertEquals(400, m.executionCount());
        assertEquals(100, m.failureCount());
        assertEquals(75.0, m.successRate(), 1e-9);
        assertNotNull(m.lastExecutionTime());
        assertTrue(table.snapshot().containsKey("simulate"));
    }
}
