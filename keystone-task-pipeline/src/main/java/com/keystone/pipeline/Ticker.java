package com.keystone.pipeline;

/** Monotonic time source for wait deadlines, in nanoseconds. */
@FunctionalInterface
public interface Ticker {

    Ticker SYSTEM = System::nanoTime;

    long nanoTime();
}
