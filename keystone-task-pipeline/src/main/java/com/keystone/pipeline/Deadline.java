package com.keystone.pipeline;

import java.time.Duration;

/** Wait deadline on a {@link Ticker}; an absent timeout never expires. */
final class Deadline {

    private final Ticker ticker;
    private final long deadlineNanos;
    private final boolean bounded;

    private Deadline(Ticker ticker, long deadlineNanos, boolean bounded) {
        this.ticker = ticker;
        this.deadlineNanos = deadlineNanos;
        this.bounded = bounded;
    }

    static Deadline after(Ticker ticker, Duration timeout) {
        if (timeout == null) {
            return new Deadline(ticker, 0L, false);
        }
        return new Deadline(ticker, ticker.nanoTime() + timeout.toNanos(), true);
    }

    boolean expired() {
        return bounded && ticker.nanoTime() - deadlineNanos >= 0;
    }

    /** {@code interval}, shortened so the sleep does not run past the deadline. */
    Duration clamp(Duration interval) {
        if (!bounded) {
            return interval;
        }
        long remaining = deadlineNanos - ticker.nanoTime();
        return remaining < interval.toNanos() ? Duration.ofNanos(Math.max(0L, remaining)) : interval;
    }
}
