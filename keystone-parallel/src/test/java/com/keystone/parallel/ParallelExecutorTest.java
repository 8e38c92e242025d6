package com.keystone.parallel;

import com.keystone.task.TaskTimeoutException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParallelExecutorTest {

    private static int sleepThenReturn(long millis, int value) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("interrupted", e);
        }
        return value;
    }

    @Test
    void executeParallelReturnsCompletionOrderWhileExecuteMapKeepsInputOrder() {
        List<Long> delays = List.of(400L, 20L, 200L);
        try (ParallelExecutor executor = new ParallelExecutor(3, PoolKind.FIXED_THREADS)) {
            List<ParallelTask<Integer>> tasks = new ArrayList<>();
            for (int i = 0; i < delays.size(); i++) {
                long d = delays.get(i);
                int v = i;
                tasks.add(new ParallelTask<>("t" + i, () -> sleepThenReturn(d, v)));
            }
            List<String> callbackOrder = Collections.synchronizedList(new ArrayList<>());

            List<TaskResult<Integer>> parallel = executor.executeParallel(tasks, r -> callbackOrder.add(r.taskId()), null);
            List<Integer> mapped = executor.executeMap(i -> sleepThenReturn(delays.get(i), i), List.of(0, 1, 2));

            assertEquals(List.of("t1", "t2", "t0"), parallel.stream().map(TaskResult::taskId).collect(Collectors.toList()));
            assertEquals(List.of("t1", "t2", "t0"), callbackOrder);
            assertEquals(List.of(0, 1, 2), mapped);
        }
    }

    @Test
    void failingTaskBecomesFailedResultWithoutAbortingOthers() {
        try (ParallelExecutor executor = new ParallelExecutor(2, PoolKind.FORK_JOIN)) {
            List<TaskResult<String>> results = executor.executeParallel(List.of(
                    new ParallelTask<String>("ok", () -> "done"),
                    new ParallelTask<String>("bad", () -> {
                        throw new IllegalStateException("solver diverged");
                    })));

            assertEquals(2, results.size());
            TaskResult<String> bad = results.stream().filter(r -> r.taskId().equals("bad")).findFirst().orElseThrow();
            assertFalse(bad.isSuccess());
            assertNull(bad.result());
            assertEquals("solver diverged", bad.error());
            assertTrue(results.stream().anyMatch(r -> r.taskId().equals("ok") && r.isSuccess() && "done".equals(r.result())));
        }
    }

    @Test
    void executeMapReportsFailingIndex() {
        try (ParallelExecutor executor = new ParallelExecutor(2, PoolKind.FIXED_THREADS)) {
            MapExecutionException e = assertThrows(MapExecutionException.class,
                    () -> executor.executeMap(i -> {
                        if (i == 2) throw new IllegalArgumentException("bad item");
                        return i * i;
                    }, List.of(1, 2, 3)));

            assertEquals(1, e.getIndex());
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    @Test
    void executeMapCallbackSeesIndicesInOrder() {
        List<Integer> indices = new ArrayList<>();
        try (ParallelExecutor executor = new ParallelExecutor(4, PoolKind.FIXED_THREADS)) {
            List<Integer> squares = executor.executeMap(x -> x * x, List.of(1, 2, 3, 4), (i, v) -> indices.add(i), null);
            assertEquals(List.of(1, 4, 9, 16), squares);
        }
        assertEquals(List.of(0, 1, 2, 3), indices);
    }

    @Test
    void overallTimeoutRaisesTaskTimeout() {
        try (ParallelExecutor executor = new ParallelExecutor(1, PoolKind.FIXED_THREADS)) {
            assertThrows(TaskTimeoutException.class, () -> executor.executeParallel(
                    List.of(new ParallelTask<Integer>("slow", () -> sleepThenReturn(2_000, 1))), null, Duration.ofMillis(100)));
        }
    }

    @Test
    void closedExecutorRejectsWork() {
        ParallelExecutor executor = new ParallelExecutor(1, PoolKind.FIXED_THREADS);
        executor.close();
        executor.close();

        assertTrue(executor.isClosed());
        assertThrows(IllegalStateException.class, () -> executor.executeMap(x -> x, List.of(1)));
    }
}
