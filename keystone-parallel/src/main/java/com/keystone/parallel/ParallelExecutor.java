package com.keystone.parallel;

import com.keystone.task.TaskTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Bounded local worker pool for fan-out that does not need the distributed queue.
 * Use with try-with-resources: {@link #close()} shuts the pool down and joins its workers.
 * <p>
 * {@link #executeParallel} returns results in completion order; {@link #executeMap} in input order.
 * Both may be called repeatedly while the executor is open.
 */
public final class ParallelExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParallelExecutor.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final int maxWorkers;
    private final PoolKind kind;
    private final ExecutorService pool;
    private volatile boolean closed;

    /** Fixed thread pool sized to the host core count. */
    public ParallelExecutor() {
        this(Runtime.getRuntime().availableProcessors(), PoolKind.FIXED_THREADS);
    }

    public ParallelExecutor(int maxWorkers, PoolKind kind) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, was " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.pool = switch (kind) {
            case FIXED_THREADS -> Executors.newFixedThreadPool(maxWorkers);
            case FORK_JOIN -> new ForkJoinPool(maxWorkers);
        };
        log.info("Initialized ParallelExecutor with {} workers ({})", maxWorkers, kind);
    }

    /**
     * Runs every task and returns one result per task in the order they finished. A task that
     * throws yields a {@link TaskResult.Status#FAILED} result; it does not abort the others.
     *
     * @param callback invoked on the calling thread for each result as it is collected; may be null
     * @param timeout  overall deadline; null waits indefinitely
     * @throws TaskTimeoutException when the deadline passes first (unfinished tasks are cancelled)
     */
    public <T> List<TaskResult<T>> executeParallel(List<ParallelTask<T>> tasks,
                                                   Consumer<TaskResult<T>> callback,
                                                   Duration timeout) {
        ensureOpen();
        CompletionService<TaskResult<T>> completion = new ExecutorCompletionService<>(pool);
        List<Future<TaskResult<T>>> futures = new ArrayList<>(tasks.size());
        for (ParallelTask<T> task : tasks) {
            futures.add(completion.submit(() -> runCapturing(task)));
            log.debug("Submitted task {}", task.id());
        }
        long deadline = timeout != null ? System.nanoTime() + timeout.toNanos() : 0L;
        List<TaskResult<T>> results = new ArrayList<>(tasks.size());
        try {
            for (int i = 0; i < tasks.size(); i++) {
                Future<TaskResult<T>> done;
                if (timeout == null) {
                    done = completion.take();
                } else {
                    done = completion.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                    if (done == null) {
                        cancelAll(futures);
                        throw new TaskTimeoutException((tasks.size() - results.size()) + " of " + tasks.size()
                                + " parallel tasks did not complete within " + timeout.toMillis() + " ms", timeout);
                    }
                }
                TaskResult<T> result = done.get();
                results.add(result);
                if (callback != null) {
                    callback.accept(result);
                }
            }
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new RuntimeException("Parallel execution interrupted", e);
        } catch (ExecutionException e) {
            // only an Error escapes runCapturing
            cancelAll(futures);
            throw new IllegalStateException("Parallel task aborted", e.getCause());
        }
        return results;
    }

    public <T> List<TaskResult<T>> executeParallel(List<ParallelTask<T>> tasks) {
        return executeParallel(tasks, null, null);
    }

    /**
     * Applies {@code fn} to every item concurrently and returns the outputs in input order.
     *
     * @param callback invoked as {@code (index, output)} in input order; may be null
     * @param timeout  overall deadline; null waits indefinitely
     * @throws MapExecutionException when an item fails (remaining items are cancelled)
     * @throws TaskTimeoutException  when the deadline passes first
     */
    public <I, O> List<O> executeMap(Function<? super I, ? extends O> fn, List<I> items,
                                     BiConsumer<Integer, O> callback, Duration timeout) {
        ensureOpen();
        log.info("Executing map over {} items", items.size());
        List<Future<O>> futures = new ArrayList<>(items.size());
        for (I item : items) {
            Callable<O> call = () -> fn.apply(item);
            futures.add(pool.submit(call));
        }
        long deadline = timeout != null ? System.nanoTime() + timeout.toNanos() : 0L;
        List<O> results = new ArrayList<>(items.size());
        int index = 0;
        try {
            for (; index < futures.size(); index++) {
                Future<O> future = futures.get(index);
                O value = timeout == null
                        ? future.get()
                        : future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                results.add(value);
                if (callback != null) {
                    callback.accept(index, value);
                }
                log.debug("Completed item {}/{}", index + 1, items.size());
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            log.error("Map execution failed at item {}: {}", index, e.getCause().getMessage());
            throw new MapExecutionException(index, e.getCause());
        } catch (TimeoutException e) {
            cancelAll(futures);
            throw new TaskTimeoutException("Map over " + items.size() + " items did not complete within "
                    + timeout.toMillis() + " ms (" + index + " done)", timeout);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new RuntimeException("Map execution interrupted", e);
        }
        return results;
    }

    public <I, O> List<O> executeMap(Function<? super I, ? extends O> fn, List<I> items) {
        return executeMap(fn, items, null, null);
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public PoolKind getKind() {
        return kind;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Stops accepting work and waits for running tasks; forces shutdown after 30s or on interrupt. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("ParallelExecutor did not terminate within {}s; forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private <T> TaskResult<T> runCapturing(ParallelTask<T> task) {
        Instant start = Instant.now();
        try {
            T value = task.work().call();
            Instant end = Instant.now();
            log.info("Task {} completed in {} ms", task.id(), Duration.between(start, end).toMillis());
            return TaskResult.success(task.id(), value, start, end);
        } catch (Exception e) {
            log.error("Task {} failed: {}", task.id(), e.toString());
            return TaskResult.failed(task.id(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    start, Instant.now());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ParallelExecutor is closed");
        }
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> f : futures) {
            f.cancel(true);
        }
    }
}
