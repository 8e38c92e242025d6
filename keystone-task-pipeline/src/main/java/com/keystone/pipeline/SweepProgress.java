package com.keystone.pipeline;

import java.util.Map;

/** Reported after each task of a parameter sweep is submitted. {@code index} is zero-based. */
public record SweepProgress(int index, int total, String taskId, Map<String, Object> params) {
}
