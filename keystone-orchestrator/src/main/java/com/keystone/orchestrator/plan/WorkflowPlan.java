package com.keystone.orchestrator.plan;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.config.ConfigurationException;
import com.keystone.routing.RoutingDecision;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered simulation steps loaded from a JSON plan file. The first step is the entry point;
 * {@code next} and {@code on_error} must name steps of the same plan or {@value RoutingDecision#TERMINAL}.
 */
public record WorkflowPlan(
        @JsonProperty("name") String name,
        @JsonProperty("steps") List<PlanStep> steps
) {
    public WorkflowPlan {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    /**
     * @throws ConfigurationException when the file cannot be read or the plan is inconsistent
     */
    public static WorkflowPlan load(Path file, ObjectMapper mapper) {
        WorkflowPlan plan;
        try {
            plan = mapper.readValue(Files.readString(file), WorkflowPlan.class);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read workflow plan " + file + ": " + e.getMessage(), e);
        }
        return plan.validate();
    }

    public WorkflowPlan validate() {
        if (steps.isEmpty()) {
            throw new ConfigurationException("steps", "Workflow plan " + name + " has no steps");
        }
        Set<String> ids = new HashSet<>();
        for (PlanStep step : steps) {
            if (step.id() == null || step.id().isBlank()) {
                throw new ConfigurationException("steps.id", "Every step needs an id");
            }
            if (RoutingDecision.TERMINAL.equals(step.id()) || !ids.add(step.id())) {
                throw new ConfigurationException("steps.id", "Duplicate or reserved step id: " + step.id());
            }
        }
        for (PlanStep step : steps) {
            requireTarget(ids, step.id(), "next", step.next());
            requireTarget(ids, step.id(), "on_error", step.onError());
        }
        return this;
    }

    public PlanStep first() {
        return steps.get(0);
    }

    public Optional<PlanStep> find(String id) {
        return steps.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    /** Success target of {@code step}: its explicit {@code next}, else the following step, else terminal. */
    public String successorOf(PlanStep step) {
        if (step.next() != null) {
            return step.next();
        }
        int index = steps.indexOf(step);
        return index + 1 < steps.size() ? steps.get(index + 1).id() : RoutingDecision.TERMINAL;
    }

    public Map<String, PlanStep> byId() {
        Map<String, PlanStep> out = new LinkedHashMap<>();
        steps.forEach(s -> out.put(s.id(), s));
        return out;
    }

    private static void requireTarget(Set<String> ids, String stepId, String field, String target) {
        if (target != null && !RoutingDecision.TERMINAL.equals(target) && !ids.contains(target)) {
            throw new ConfigurationException("steps." + field,
                    "Step " + stepId + " routes " + field + " to unknown step " + target);
        }
    }
}
