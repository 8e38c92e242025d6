package com.keystone.parallel;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** One parameter combination of a local sweep with its outcome. */
public record SweepResult<T>(
        Map<String, Object> params,
        TaskResult.Status status,
        T result,
        String error,
        Duration duration
) {
    public SweepResult {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public boolean isSuccess() {
        return status == TaskResult.Status.SUCCESS;
    }
}
