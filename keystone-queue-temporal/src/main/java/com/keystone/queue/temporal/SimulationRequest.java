package com.keystone.queue.temporal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.task.TaskSpec;

import java.util.Map;

/** Start payload of {@link SimulationWorkflow}. */
public record SimulationRequest(
        @JsonProperty("tool") String tool,
        @JsonProperty("script") String script,
        @JsonProperty("params") Map<String, Object> params
) {
    public static SimulationRequest from(TaskSpec spec) {
        return new SimulationRequest(spec.tool(), spec.script(), spec.params());
    }

    public TaskSpec toSpec() {
        return new TaskSpec(tool, script, params);
    }
}
