package com.keystone.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of the settings document ({@code keystone.json}): router defaults and the simulation catalog.
 */
public final class KeystoneSettings {

    private final String version;
    private final RoutingDefaults routing;
    private final SimulationCatalog simulations;

    @JsonCreator
    public KeystoneSettings(
            @JsonProperty("version") String version,
            @JsonProperty("routing") RoutingDefaults routing,
            @JsonProperty("simulations") SimulationCatalog simulations) {
        this.version = version != null ? version : "1.0";
        this.routing = routing != null ? routing : RoutingDefaults.defaults();
        this.simulations = simulations != null ? simulations : SimulationCatalog.empty();
    }

    public String getVersion() {
        return version;
    }

    public RoutingDefaults getRouting() {
        return routing;
    }

    public SimulationCatalog getSimulations() {
        return simulations;
    }
}
