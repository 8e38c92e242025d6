package com.keystone.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable result of a routing call: the next node (or {@link #TERMINAL}), the strategy used,
 * a human-readable reason, decision metadata and ordered fallback nodes.
 * Metadata values may be null (e.g. an output value that was absent).
 */
public record RoutingDecision(
        @JsonProperty("next_node") String nextNode,
        @JsonProperty("strategy") RoutingStrategy strategy,
        @JsonProperty("reason") String reason,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("fallback_nodes") List<String> fallbackNodes
) {
    /** Node name meaning "end the workflow". */
    public static final String TERMINAL = "__end__";

    public RoutingDecision {
        Objects.requireNonNull(nextNode, "nextNode");
        Objects.requireNonNull(strategy, "strategy");
        reason = reason != null ? reason : "";
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        fallbackNodes = fallbackNodes != null ? List.copyOf(fallbackNodes) : List.of();
    }

    public static RoutingDecision of(String nextNode, RoutingStrategy strategy, String reason, Map<String, Object> metadata) {
        return new RoutingDecision(nextNode, strategy, reason, metadata, List.of());
    }

    @JsonIgnore
    public boolean isTerminal() {
        return TERMINAL.equals(nextNode);
    }
}
