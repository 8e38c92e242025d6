package com.keystone.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One simulation tool known to the worker pool: a description and the scripts it can run.
 */
public record SimulationTool(
        @JsonProperty("description") String description,
        @JsonProperty("scripts") List<String> scripts
) {
    public SimulationTool {
        description = description != null ? description : "";
        scripts = scripts != null ? List.copyOf(scripts) : List.of();
    }
}
