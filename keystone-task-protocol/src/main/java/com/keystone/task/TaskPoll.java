package com.keystone.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One raw poll answer from a {@link TaskQueue}. {@code progress} is 0..100 when the backend
 * reports it; {@code spec} is null when the backend does not echo the submitted spec.
 */
public record TaskPoll(
        TaskState state,
        Integer progress,
        Map<String, Object> result,
        String error,
        TaskSpec spec
) {
    public TaskPoll {
        Objects.requireNonNull(state, "state");
        if (progress != null) {
            progress = Math.max(0, Math.min(100, progress));
        }
        result = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : null;
    }

    public static TaskPoll of(TaskState state) {
        return new TaskPoll(state, null, null, null, null);
    }
}
