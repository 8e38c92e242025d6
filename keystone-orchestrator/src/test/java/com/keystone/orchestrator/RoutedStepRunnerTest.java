package com.keystone.orchestrator;

import com.keystone.orchestrator.plan.PlanStep;
import com.keystone.orchestrator.plan.WorkflowPlan;
import com.keystone.pipeline.PipelineContext;
import com.keystone.pipeline.TaskLifecycleClient;
import com.keystone.routing.NodeStatus;
import com.keystone.routing.RoutingDecision;
import com.keystone.routing.RoutingStrategy;
import com.keystone.routing.WorkflowRouter;
import com.keystone.routing.metrics.CircuitBreakerRegistry;
import com.keystone.routing.metrics.ExecutionMetricsTable;
import com.keystone.task.TaskOutcome;
import com.keystone.task.memory.InMemoryTaskQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoutedStepRunnerTest {

    private InMemoryTaskQueue queue;
    private List<Duration> sleeps;
    private TaskLifecycleClient client;
    private ExecutionMetricsTable metrics;

    @BeforeEach
    void setUp() {
        queue = new InMemoryTaskQueue();
        sleeps = new ArrayList<>();
        client = new TaskLifecycleClient(PipelineContext.builder(queue)
                .sleeper(sleeps::add)
                .defaultTimeout(Duration.ofMinutes(1))
                .build());
        metrics = new ExecutionMetricsTable();
    }

    private RoutedStepRunner runner(int maxRetries, int threshold) {
        return new RoutedStepRunner(client, new WorkflowRouter(maxRetries, threshold, 2.0),
                metrics, new CircuitBreakerRegistry(threshold));
    }

    private static PlanStep step(String id, String onError, boolean retry) {
        return new PlanStep(id, "lammps", id + ".lammps", Map.of(), null, onError, retry, null);
    }

    /** Completes tasks of scripts in {@code failing} with a failure for their first {@code failures} submissions. */
    private void workers(String failingScript, int failures) {
        AtomicInteger failed = new AtomicInteger();
        queue.setSubmitListener((id, spec) -> {
            if (spec.script().equals(failingScript) && failed.getAndIncrement() < failures) {
                queue.fail(id, "segfault");
            } else {
                queue.complete(id, Map.of("duration_seconds", 3.0));
            }
        });
    }

    @Test
    void linearPlanRunsEveryStepOnce() throws Exception {
        workers("none", 0);
        WorkflowPlan plan = new WorkflowPlan("linear", List.of(step("mesh", null, false), step("solve", null, false)));

        RunReport report = runner(3, 5).run(plan);

        assertTrue(report.succeeded());
        assertEquals(2, report.executions().size());
        assertEquals("solve", report.executions().get(0).decision().nextNode());
        assertTrue(report.executions().get(1).decision().isTerminal());
        assertEquals(NodeStatus.COMPLETED, report.finalState().statusOf("solve"));
        assertEquals(3.0, report.finalState().resultsOf("mesh").get("duration_seconds"));
        assertEquals(1, metrics.get("mesh").orElseThrow().executionCount());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void failedStepIsRetriedWithGrowingBackoff() throws Exception {
        workers("mesh.lammps", 2);
        WorkflowPlan plan = new WorkflowPlan("retry", List.of(step("mesh", null, true)));

        RunReport report = runner(3, 5).run(plan);

        assertTrue(report.succeeded());
        assertEquals(3, report.executions().size());
        assertEquals(RoutingStrategy.RETRY_WITH_BACKOFF, report.executions().get(0).decision().strategy());
        assertEquals(2, report.executions().get(1).attempt());
        assertEquals(TaskOutcome.Kind.SUCCEEDED, report.executions().get(2).outcome());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        assertEquals(2, metrics.get("mesh").orElseThrow().failureCount());
        assertEquals(2, report.finalState().getErrors().size());
    }

    @Test
    void exhaustedRetriesFallBackToErrorStep() throws Exception {
        workers("mesh.lammps", Integer.MAX_VALUE);
        WorkflowPlan plan = new WorkflowPlan("fallback", List.of(
                new PlanStep("mesh", "lammps", "mesh.lammps", Map.of(), RoutingDecision.TERMINAL, "report", true, null),
                step("report", null, false)));

        RunReport report = runner(3, 5).run(plan);

        assertFalse(report.succeeded());
        assertEquals(5, report.executions().size());
        StepExecution fallback = report.executions().get(3);
        assertEquals(RoutingStrategy.ERROR_FALLBACK, fallback.decision().strategy());
        assertEquals("report", fallback.decision().nextNode());
        assertEquals("report", report.executions().get(4).step());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
    }

    @Test
    void failureWithoutRetryEndsRun() throws Exception {
        workers("mesh.lammps", 1);
        WorkflowPlan plan = new WorkflowPlan("no-retry", List.of(step("mesh", null, false), step("solve", null, false)));

        RunReport report = runner(3, 5).run(plan);

        assertFalse(report.succeeded());
        assertEquals(1, report.executions().size());
        assertTrue(report.executions().get(0).decision().isTerminal());
        assertEquals(NodeStatus.FAILED, report.finalState().statusOf("mesh"));
    }

    @Test
    void openCircuitStopsRetriesAndIsRemembered() throws Exception {
        workers("mesh.lammps", Integer.MAX_VALUE);
        RoutedStepRunner runner = runner(3, 2);
        WorkflowPlan plan = new WorkflowPlan("breaker", List.of(step("mesh", null, true)));

        RunReport first = runner.run(plan);

        assertFalse(first.succeeded());
        assertEquals(2, first.executions().size());
        assertEquals(RoutingStrategy.CIRCUIT_BREAKER, first.executions().get(1).decision().strategy());

        int submitted = queue.submittedIds().size();
        RunReport second = runner.run(plan);

        assertEquals(submitted, queue.submittedIds().size());
        assertNull(second.executions().get(0).taskId());
        assertEquals(RoutingStrategy.CIRCUIT_BREAKER, second.executions().get(0).decision().strategy());
    }

    @Test
    void openCircuitOutlivesTheRunnerThatOpenedIt() throws Exception {
        workers("mesh.lammps", 2);
        CircuitBreakerRegistry shared = new CircuitBreakerRegistry(2);
        WorkflowRouter router = new WorkflowRouter(3, 2, 2.0);
        WorkflowPlan plan = new WorkflowPlan("breaker", List.of(step("mesh", null, true)));

        assertFalse(new RoutedStepRunner(client, router, metrics, shared).run(plan).succeeded());
        assertTrue(shared.isOpen("mesh"));

        int submitted = queue.submittedIds().size();
        RunReport later = new RoutedStepRunner(client, router, metrics, shared).run(plan);

        assertFalse(later.succeeded());
        assertEquals(submitted, queue.submittedIds().size());
        assertTrue(shared.isOpen("mesh"));

        RunReport fresh = new RoutedStepRunner(client, router, metrics, new CircuitBreakerRegistry(2)).run(plan);

        assertTrue(fresh.succeeded());
        assertEquals(submitted + 1, queue.submittedIds().size());
    }
}
