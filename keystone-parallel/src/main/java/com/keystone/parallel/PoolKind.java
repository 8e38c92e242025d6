package com.keystone.parallel;

/** Backing pool of a {@link ParallelExecutor}. */
public enum PoolKind {
    /** Fixed-size platform thread pool; suited to blocking or I/O-bound work. */
    FIXED_THREADS,
    /** Work-stealing pool with the given parallelism; suited to CPU-bound work. */
    FORK_JOIN
}
