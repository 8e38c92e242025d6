package com.keystone.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Simulation tools and scripts advertised to callers (tool name → {@link SimulationTool}).
 * Informational only: task submission does not reject tools missing from the catalog.
 */
public final class SimulationCatalog {

    private final Map<String, SimulationTool> tools;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public SimulationCatalog(Map<String, SimulationTool> tools) {
        this.tools = tools != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(tools))
                : Map.of();
    }

    public static SimulationCatalog empty() {
        return new SimulationCatalog(Map.of());
    }

    @JsonValue
    public Map<String, SimulationTool> getTools() {
        return tools;
    }

    public Optional<SimulationTool> find(String tool) {
        return tool != null ? Optional.ofNullable(tools.get(tool)) : Optional.empty();
    }

    public boolean supports(String tool, String script) {
        return find(tool).map(t -> t.scripts().contains(script)).orElse(false);
    }

    public int size() {
        return tools.size();
    }
}
