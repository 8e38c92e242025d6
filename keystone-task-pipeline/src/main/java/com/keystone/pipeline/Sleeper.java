package com.keystone.pipeline;

import java.time.Duration;

/** Suspends the polling thread between status checks. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
