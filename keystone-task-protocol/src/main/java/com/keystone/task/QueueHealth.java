package com.keystone.task;

/** Reachability of the queue backend. */
public record QueueHealth(boolean healthy, String detail) {

    public static QueueHealth up(String detail) {
        return new QueueHealth(true, detail);
    }

    public static QueueHealth down(String detail) {
        return new QueueHealth(false, detail);
    }
}
