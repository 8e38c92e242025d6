package com.keystone.parallel;

import com.keystone.task.ParameterGrid;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class BatchProcessorTest {

    @Test
    void sweepPairsEachCombinationWithItsOwnResult() {
        Map<String, List<?>> grid = new LinkedHashMap<>();
        grid.put("mesh_size", List.of(64, 16));
        grid.put("time_steps", List.of(100, 200));
        List<Map<String, Object>> seen = Collections.synchronizedList(new ArrayList<>());

        // larger meshes finish later, so completion order differs from combination order
        List<SweepResult<Integer>> results = new BatchProcessor(4, PoolKind.FIXED_THREADS).parameterSweep(p -> {
            int mesh = (Integer) p.get("mesh_size");
            int steps = (Integer) p.get("time_steps");
            try {
                Thread.sleep(mesh * 3L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException(e);
            }
            return mesh * steps;
        }, ParameterGrid.of(grid), (params, result) -> seen.add(params));

        assertEquals(4, results.size());
        assertEquals(4, seen.size());
        for (SweepResult<Integer> r : results) {
            int expected = (Integer) r.params().get("mesh_size") * (Integer) r.params().get("time_steps");
            assertEquals(expected, r.result());
        }
        assertEquals(Map.of("mesh_size", 64, "time_steps", 100), results.get(0).params());
        assertEquals(Map.of("mesh_size", 16, "time_steps", 200), results.get(3).params());
    }

    @Test
    void sweepRecordsFailuresPerCombination() {
        List<SweepResult<Integer>> results = new BatchProcessor(2, PoolKind.FORK_JOIN).parameterSweep(p -> {
            if ((Integer) p.get("x") < 0) throw new IllegalArgumentException("negative");
            return (Integer) p.get("x");
        }, ParameterGrid.of(Map.of("x", List.of(1, -1))), null);

        assertEquals(1, results.get(0).result());
        assertFalse(results.get(1).isSuccess());
        assertEquals("negative", results.get(1).error());
    }

    @Test
    void batchExecutePreservesInputOrder() {
        List<String> out = new BatchProcessor(3, PoolKind.FIXED_THREADS)
                .batchExecute(s -> s.toUpperCase(), List.of("poisson", "cavity", "melt"), null);

        assertEquals(List.of("POISSON", "CAVITY", "MELT"), out);
    }
}
