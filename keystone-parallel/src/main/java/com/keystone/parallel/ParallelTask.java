package com.keystone.parallel;

import java.util.Objects;
import java.util.concurrent.Callable;

/** A unit of local work with a caller-chosen id. */
public record ParallelTask<T>(String id, Callable<T> work) {

    public ParallelTask {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(work, "work");
    }
}
