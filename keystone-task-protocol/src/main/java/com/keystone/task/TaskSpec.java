package com.keystone.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What to run: a simulation tool, the script it executes, and script parameters.
 * Validation of tool and script happens at submission, not here.
 */
public record TaskSpec(
        @JsonProperty("tool") String tool,
        @JsonProperty("script") String script,
        @JsonProperty("params") Map<String, Object> params
) {
    public TaskSpec {
        params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
    }

    public static TaskSpec of(String tool, String script) {
        return new TaskSpec(tool, script, Map.of());
    }

    /**
     * @throws SubmissionException when tool or script is null or blank
     */
    public TaskSpec requireValid() {
        if (tool == null || tool.isBlank()) {
            throw new SubmissionException("Task tool is required");
        }
        if (script == null || script.isBlank()) {
            throw new SubmissionException("Task script is required for tool " + tool);
        }
        return this;
    }
}
