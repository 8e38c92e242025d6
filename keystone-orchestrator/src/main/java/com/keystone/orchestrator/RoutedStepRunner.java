package com.keystone.orchestrator;

import com.keystone.orchestrator.plan.PlanStep;
import com.keystone.orchestrator.plan.WorkflowPlan;
import com.keystone.pipeline.Sleeper;
import com.keystone.pipeline.TaskLifecycleClient;
import com.keystone.routing.NodeStatus;
import com.keystone.routing.RoutingDecision;
import com.keystone.routing.RoutingStrategy;
import com.keystone.routing.WorkflowRouter;
import com.keystone.routing.WorkflowRoutingState;
import com.keystone.routing.metrics.CircuitBreakerRegistry;
import com.keystone.routing.metrics.CircuitBreakerState;
import com.keystone.routing.metrics.ExecutionMetricsTable;
import com.keystone.task.SubmissionException;
import com.keystone.task.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives a {@link WorkflowPlan}: submit the current step, await its outcome, fold the outcome into
 * the routing state, execution metrics and circuit breakers, then follow
 * {@link WorkflowRouter#routeAfterExecution}. Retries sleep the decision's backoff first. A step
 * whose circuit is already open is not submitted.
 *
 * <p>The {@link CircuitBreakerRegistry} is shared by every runner of a {@link KeystoneBootstrap},
 * so an open circuit blocks its node for the rest of the process. There is no cooldown or
 * half-open trial: only a recorded success closes a circuit, and a blocked node records nothing.
 * Restarting the process (or building a new bootstrap) clears every circuit.
 */
public final class RoutedStepRunner {

    private static final Logger log = LoggerFactory.getLogger(RoutedStepRunner.class);

    private final TaskLifecycleClient client;
    private final WorkflowRouter router;
    private final ExecutionMetricsTable metrics;
    private final CircuitBreakerRegistry circuits;
    private final Sleeper sleeper;

    public RoutedStepRunner(TaskLifecycleClient client, WorkflowRouter router,
                            ExecutionMetricsTable metrics, CircuitBreakerRegistry circuits) {
        this.client = Objects.requireNonNull(client, "client");
        this.router = Objects.requireNonNull(router, "router");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.circuits = Objects.requireNonNull(circuits, "circuits");
        this.sleeper = client.getContext().getSleeper();
    }

    /**
     * @throws SubmissionException   when a step's task cannot be submitted
     * @throws IllegalStateException when the plan keeps routing past its transition budget
     * @throws InterruptedException  when interrupted during a backoff sleep
     */
    public RunReport run(WorkflowPlan plan) throws InterruptedException {
        plan.validate();
        Map<String, PlanStep> steps = plan.byId();
        int budget = steps.size() * (router.getMaxRetries() + 2);
        List<StepExecution> executions = new ArrayList<>();
        WorkflowRoutingState state = WorkflowRoutingState.empty();
        PlanStep current = plan.first();
        int attempt = 1;

        log.info("Running plan {} ({} steps)", plan.name(), steps.size());
        while (current != null) {
            if (executions.size() >= budget) {
                throw new IllegalStateException("Plan " + plan.name() + " exceeded " + budget + " step executions");
            }
            String node = current.id();
            String taskId = null;
            TaskOutcome outcome = null;
            if (circuits.isOpen(node)) {
                log.warn("Circuit open for {}; not submitting", node);
                state = state.toBuilder()
                        .circuitBreakerOpen(true)
                        .circuitBreakerFailures(circuits.get(node).failureCount())
                        .build();
            } else {
                taskId = client.submitTask(current.toSpec());
                outcome = client.awaitTask(taskId, current.timeout(client.getContext().getDefaultTimeout()));
                state = fold(state, node, attempt, outcome);
            }

            String retryNode = current.retry() ? node : null;
            String errorNode = current.onError() != null ? current.onError() : RoutingDecision.TERMINAL;
            RoutingDecision decision = router.routeAfterExecution(state, node, plan.successorOf(current), errorNode, retryNode);
            executions.add(new StepExecution(node, attempt, taskId,
                    outcome != null ? outcome.kind() : null,
                    outcome != null ? outcome.message() : "circuit open",
                    decision));
            log.info("Step {} attempt {} -> {} ({})", node, attempt, decision.nextNode(), decision.strategy().toValue());

            switch (decision.strategy()) {
                case RETRY_WITH_BACKOFF:
                    sleepBackoff(decision);
                    state = state.toBuilder().retryCount(state.getRetryCount() + 1).build();
                    attempt++;
                    break;
                case SUCCESS_PATH:
                case ERROR_FALLBACK:
                case CIRCUIT_BREAKER:
                    state = state.toBuilder().retryCount(0).circuitBreakerOpen(false).circuitBreakerFailures(0).build();
                    attempt = 1;
                    break;
                default:
                    throw new IllegalStateException("Unexpected strategy after execution: " + decision.strategy());
            }
            current = decision.isTerminal() ? null : steps.get(decision.nextNode());
        }

        boolean succeeded = executions.stream()
                .map(e -> e.decision().strategy())
                .allMatch(s -> s == RoutingStrategy.SUCCESS_PATH || s == RoutingStrategy.RETRY_WITH_BACKOFF);
        log.info("Plan {} finished: {} after {} executions", plan.name(), succeeded ? "succeeded" : "failed", executions.size());
        return new RunReport(plan.name(), succeeded, executions, state);
    }

    private WorkflowRoutingState fold(WorkflowRoutingState state, String node, int attempt, TaskOutcome outcome) {
        boolean success = outcome.isSuccess();
        if (success) {
            double seconds = outcome.status().durationSeconds();
            metrics.recordSuccess(node, Duration.ofMillis(Math.round(seconds * 1000)));
        } else {
            metrics.recordFailure(node);
        }
        CircuitBreakerState circuit = circuits.record(node, success);

        WorkflowRoutingState.Builder next = state.toBuilder()
                .nodeStatus(node, toNodeStatus(outcome.kind()))
                .circuitBreakerOpen(circuit.open())
                .circuitBreakerFailures(circuit.failureCount())
                .circuitBreakerThreshold(circuit.threshold());
        metrics.get(node).ifPresent(m -> next.executionMetrics(node, m));
        if (success) {
            next.nodeResult(node, outcome.result());
        } else {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("node", node);
            error.put("attempt", attempt);
            error.put("kind", outcome.kind().name());
            error.put("message", outcome.message());
            next.addError(error);
        }
        return next.build();
    }

    static NodeStatus toNodeStatus(TaskOutcome.Kind kind) {
        switch (kind) {
            case SUCCEEDED:
                return NodeStatus.COMPLETED;
            case TIMED_OUT:
                return NodeStatus.TIMEOUT;
            case FAILED:
            case CANCELLED:
                return NodeStatus.FAILED;
            default:
                throw new IllegalArgumentException("Unknown outcome: " + kind);
        }
    }

    private void sleepBackoff(RoutingDecision decision) throws InterruptedException {
        Object value = decision.metadata().get("backoff_seconds");
        double seconds = value instanceof Number n ? n.doubleValue() : 0.0;
        if (seconds > 0) {
            log.debug("Backing off {}s before retry", seconds);
            sleeper.sleep(Duration.ofMillis(Math.round(seconds * 1000)));
        }
    }
}
