package com.keystone.routing;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One ordered rule for {@link WorkflowRouter#routeByContext}: when {@code condition} accepts the
 * context value, route to {@code node}. The predicate receives null when the key is absent.
 */
public record ContextRule(Predicate<Object> condition, String node, String reason) {

    public ContextRule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(node, "node");
    }

    public static ContextRule whenEquals(Object expected, String node, String reason) {
        return new ContextRule(v -> Objects.equals(expected, v), node, reason);
    }
}
