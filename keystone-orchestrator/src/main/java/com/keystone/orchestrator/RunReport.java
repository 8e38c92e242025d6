package com.keystone.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.routing.WorkflowRoutingState;

import java.util.List;

/**
 * Result of driving a plan to a terminal decision. {@code succeeded} is true when every step
 * eventually took the success path; any error fallback or open circuit makes it false, even when
 * the error step itself completed.
 */
public record RunReport(
        @JsonProperty("plan") String plan,
        @JsonProperty("succeeded") boolean succeeded,
        @JsonProperty("executions") List<StepExecution> executions,
        @JsonProperty("final_state") WorkflowRoutingState finalState
) {
    public RunReport {
        executions = List.copyOf(executions);
    }
}
