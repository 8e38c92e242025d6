package com.keystone.parallel;

import com.keystone.task.ParameterGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Local parameter sweeps and batch maps. Each call opens its own {@link ParallelExecutor}
 * and closes it before returning.
 */
public final class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);
    private static final String SWEEP_ID_PREFIX = "sweep_";

    private final int maxWorkers;
    private final PoolKind kind;

    public BatchProcessor(int maxWorkers, PoolKind kind) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, was " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        this.kind = kind;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * Runs {@code fn} once per grid combination. Results are returned in combination order, each
     * paired with its own parameters regardless of completion order.
     *
     * @param callback {@code (params, result)} per finished combination in completion order; result is null on failure
     */
    public <T> List<SweepResult<T>> parameterSweep(Function<Map<String, Object>, T> fn, ParameterGrid grid,
                                                   BiConsumer<Map<String, Object>, T> callback) {
        List<Map<String, Object>> combinations = grid.combinations();
        log.info("Running parameter sweep with {} combinations", combinations.size());
        List<ParallelTask<T>> tasks = new ArrayList<>(combinations.size());
        for (int i = 0; i < combinations.size(); i++) {
            Map<String, Object> params = combinations.get(i);
            tasks.add(new ParallelTask<>(SWEEP_ID_PREFIX + i, () -> fn.apply(params)));
        }
        Map<String, TaskResult<T>> byId = new HashMap<>();
        try (ParallelExecutor executor = new ParallelExecutor(maxWorkers, kind)) {
            executor.executeParallel(tasks, r -> {
                byId.put(r.taskId(), r);
                if (callback != null) {
                    callback.accept(combinations.get(indexOf(r.taskId())), r.result());
                }
            }, null);
        }
        List<SweepResult<T>> results = new ArrayList<>(combinations.size());
        for (int i = 0; i < combinations.size(); i++) {
            TaskResult<T> r = byId.get(SWEEP_ID_PREFIX + i);
            results.add(new SweepResult<>(combinations.get(i), r.status(), r.result(), r.error(), r.duration()));
        }
        long ok = results.stream().filter(SweepResult::isSuccess).count();
        log.info("Parameter sweep complete: {}/{} successful", ok, results.size());
        return results;
    }

    /**
     * Maps {@code fn} over {@code items} in parallel; outputs follow input order.
     *
     * @throws MapExecutionException when any item fails
     */
    public <I, O> List<O> batchExecute(Function<? super I, ? extends O> fn, List<I> items, BiConsumer<Integer, O> callback) {
        log.info("Batch executing {} items", items.size());
        try (ParallelExecutor executor = new ParallelExecutor(maxWorkers, kind)) {
            return executor.executeMap(fn, items, callback, null);
        }
    }

    private static int indexOf(String taskId) {
        return Integer.parseInt(taskId.substring(SWEEP_ID_PREFIX.length()));
    }
}
