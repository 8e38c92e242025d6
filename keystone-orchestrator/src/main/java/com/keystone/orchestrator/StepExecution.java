package com.keystone.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.keystone.routing.RoutingDecision;
import com.keystone.task.TaskOutcome;

/** One attempt of a plan step and the routing decision taken after it. taskId is null when the step was skipped. */
public record StepExecution(
        @JsonProperty("step") String step,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("outcome") TaskOutcome.Kind outcome,
        @JsonProperty("message") String message,
        @JsonProperty("decision") RoutingDecision decision
) {
}
