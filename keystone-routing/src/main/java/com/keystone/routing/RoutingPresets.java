package com.keystone.routing;

import com.keystone.config.RoutingDefaults;

import java.util.Locale;
import java.util.Map;

/**
 * Ready-made conditional-edge functions for the simulation workflow graph. Each reads the
 * routing state and returns the name of the next node.
 */
public final class RoutingPresets {

    public static final String DEFAULT_PERFORMER = "fenicsx_performer";

    private static final Map<String, String> PERFORMER_BY_TOOL = Map.of(
            "fenicsx", "fenicsx_performer",
            "lammps", "lammps_performer",
            "openfoam", "openfoam_performer");

    private RoutingPresets() {
    }

    /**
     * {@code aggregate} when {@code node_results.validate.validation_passed} is true; otherwise
     * {@code error} on a critical error or exhausted retries, else {@code refine}.
     */
    public static String routeByValidationResult(WorkflowRoutingState state) {
        Object passed = state.resultsOf("validate").get("validation_passed");
        if (Boolean.TRUE.equals(passed) || "true".equals(String.valueOf(passed))) {
            return "aggregate";
        }
        if (state.getErrorSeverity() == ErrorSeverity.CRITICAL) {
            return "error";
        }
        int maxRetries = state.getMaxRetries() != null ? state.getMaxRetries() : RoutingDefaults.DEFAULT_MAX_RETRIES;
        return state.getRetryCount() < maxRetries ? "refine" : "error";
    }

    /** Performer node for {@code node_results.plan.required_tool}; unknown or missing tools use fenicsx. */
    public static String routeBySimulationTool(WorkflowRoutingState state) {
        Object tool = state.resultsOf("plan").get("required_tool");
        if (tool == null) {
            return DEFAULT_PERFORMER;
        }
        return PERFORMER_BY_TOOL.getOrDefault(tool.toString().trim().toLowerCase(Locale.ROOT), DEFAULT_PERFORMER);
    }

    /** Maps {@code node_results.handle_error.strategy} to {@code delegate}, {@code alternative_execution} or terminal. */
    public static String routeAfterErrorHandling(WorkflowRoutingState state) {
        Object strategy = state.resultsOf("handle_error").get("strategy");
        ErrorResolution resolution = ErrorResolution.fromValue(strategy != null ? strategy.toString() : null);
        return switch (resolution) {
            case RETRY -> "delegate";
            case ALTERNATIVE_PATH -> "alternative_execution";
            case TERMINATE -> RoutingDecision.TERMINAL;
        };
    }

    /** {@code workflow_context.priority}: high → fast path, low → batch queue, anything else → standard path. */
    public static String routeByPriority(WorkflowRoutingState state) {
        Object priority = state.getWorkflowContext().get("priority");
        if ("high".equals(priority)) {
            return "fast_execution_path";
        }
        if ("low".equals(priority)) {
            return "batch_queue";
        }
        return "standard_execution_path";
    }
}
