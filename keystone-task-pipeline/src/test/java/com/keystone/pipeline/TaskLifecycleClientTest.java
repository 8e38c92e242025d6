package com.keystone.pipeline;

import com.keystone.config.SimulationCatalog;
import com.keystone.config.SimulationTool;
import com.keystone.task.CancellationFailureException;
import com.keystone.task.RemoteExecutionException;
import com.keystone.task.SubmissionException;
import com.keystone.task.TaskOutcome;
import com.keystone.task.TaskPoll;
import com.keystone.task.TaskQueue;
import com.keystone.task.TaskSpec;
import com.keystone.task.TaskState;
import com.keystone.task.TaskStatus;
import com.keystone.task.TaskTimeoutException;
import com.keystone.task.memory.InMemoryTaskQueue;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskLifecycleClientTest {

    private InMemoryTaskQueue queue;
    private FakeClock clock;
    private SimpleMeterRegistry registry;
    private TaskLifecycleClient client;

    @BeforeEach
    void setUp() {
        queue = new InMemoryTaskQueue();
        clock = new FakeClock();
        registry = new SimpleMeterRegistry();
        client = new TaskLifecycleClient(PipelineContext.builder(queue)
                .pollInterval(Duration.ofSeconds(2))
                .sleeper(clock)
                .ticker(clock)
                .meterRegistry(registry)
                .build());
    }

    @Test
    void submitReturnsIdAndCountsByTool() {
        String id = client.submitTask("fenicsx", "poisson.py", Map.of("mesh_size", 32));

        assertEquals(TaskState.PENDING, client.getTaskStatus(id).state());
        assertEquals(32, queue.specOf(id).params().get("mesh_size"));
        assertEquals(1.0, registry.counter(PipelineMetrics.SUBMITTED, "tool", "fenicsx").count());
    }

    @Test
    void submitRejectsMissingToolOrScript() {
        assertThrows(SubmissionException.class, () -> client.submitTask(null, "poisson.py", Map.of()));
        assertThrows(SubmissionException.class, () -> client.submitTask("fenicsx", " ", Map.of()));
        assertTrue(queue.submittedIds().isEmpty());
    }

    @Test
    void backendRejectionIsWrapped() {
        TaskQueue broken = new TaskQueue() {
            @Override
            public String submit(TaskSpec spec) {
                throw new IllegalStateException("broker down");
            }

            @Override
            public TaskPoll poll(String taskId) {
                return TaskPoll.of(TaskState.PENDING);
            }

            @Override
            public boolean cancel(String taskId) {
                throw new IllegalStateException("broker down");
            }
        };
        TaskLifecycleClient c = new TaskLifecycleClient(PipelineContext.builder(broken).build());

        SubmissionException e = assertThrows(SubmissionException.class, () -> c.submitTask(TaskSpec.of("lammps", "example.lammps")));
        assertTrue(e.getMessage().contains("broker down"));
        assertFalse(c.cancelTask("any"));
    }

    @Test
    void statusReadsAreIdempotent() {
        String id = client.submitTask("lammps", "example.lammps", null);
        queue.markRunning(id, 50);

        TaskStatus first = client.getTaskStatus(id);
        TaskStatus second = client.getTaskStatus(id);

        assertEquals(first, second);
        assertFalse(first.ready());
        assertNull(first.successful());
        assertEquals(50, first.progress());
        assertEquals("lammps", first.tool());
    }

    @Test
    void waitForTaskReturnsResultAfterPolling() {
        String id = client.submitTask("lammps", "example.lammps", null);
        int[] polls = {0};
        clock.onSleep(() -> {
            if (++polls[0] == 3) {
                queue.complete(id, Map.of("duration_seconds", 4.5));
            }
        });

        Map<String, Object> result = client.waitForTask(id, Duration.ofMinutes(1));

        assertEquals(4.5, result.get("duration_seconds"));
        assertEquals(3, clock.sleeps().size());
        assertEquals(1.0, registry.counter(PipelineMetrics.FINISHED, "state", "SUCCESS").count());
        assertEquals(1L, registry.get(PipelineMetrics.WAIT).tag("outcome", "SUCCEEDED").timer().count());
    }

    @Test
    void waitForTaskRaisesRemoteFailure() {
        String id = client.submitTask("openfoam", "example_cavity.py", null);
        queue.fail(id, "solver diverged");

        RemoteExecutionException e = assertThrows(RemoteExecutionException.class,
                () -> client.waitForTask(id, Duration.ofSeconds(10)));
        assertEquals(TaskState.FAILURE, e.getState());
        assertTrue(e.getMessage().contains("solver diverged"));
    }

    @Test
    void remoteTimeoutIsAFailureNotAWaitTimeout() {
        String id = client.submitTask("openfoam", "example_cavity.py", null);
        queue.timeOut(id);

        TaskOutcome outcome = client.awaitTask(id, Duration.ofSeconds(10));

        assertEquals(TaskOutcome.Kind.FAILED, outcome.kind());
        assertTrue(outcome.result().isEmpty());
    }

    @Test
    void waitTimesOutWithinOnePollInterval() {
        String id = client.submitTask("lammps", "example.lammps", null);

        TaskTimeoutException e = assertThrows(TaskTimeoutException.class,
                () -> client.waitForTask(id, Duration.ofSeconds(5)));

        assertEquals(Duration.ofSeconds(5), e.getTimeout());
        assertTrue(clock.elapsed().compareTo(Duration.ofSeconds(5).plus(Duration.ofSeconds(2))) < 0);
        assertEquals(1L, registry.get(PipelineMetrics.WAIT).tag("outcome", "TIMED_OUT").timer().count());
    }

    @Test
    void monitorPassesEverySnapshotAndEndsOnReady() {
        String id = client.submitTask("fenicsx", "poisson.py", null);
        int[] polls = {0};
        clock.onSleep(() -> {
            polls[0]++;
            if (polls[0] == 1) {
                queue.markRunning(id, 30);
            } else if (polls[0] == 2) {
                queue.complete(id, Map.of());
            }
        });
        List<TaskStatus> seen = new ArrayList<>();

        TaskStatus last = client.monitorTask(id, seen::add, Duration.ofSeconds(1));

        assertEquals(3, seen.size());
        assertEquals(TaskState.PENDING, seen.get(0).state());
        assertEquals(TaskState.RUNNING, seen.get(1).state());
        assertEquals(last, seen.get(2));
        assertTrue(last.successful());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(1)), clock.sleeps());
    }

    @Test
    void cancelReportsAcceptance() {
        String live = client.submitTask("lammps", "example.lammps", null);
        String done = client.submitTask("lammps", "example.lammps", null);
        queue.complete(done, Map.of());

        assertTrue(client.cancelTask(live));
        assertEquals(TaskState.CANCELLED, client.getTaskStatus(live).state());
        assertFalse(client.cancelTask(done));
        assertThrows(CancellationFailureException.class, () -> client.requireCancelled(done));
        assertEquals(1.0, registry.counter(PipelineMetrics.CANCEL, "accepted", "true").count());
    }

    @Test
    void cancelledTaskRaisesOnWait() {
        String id = client.submitTask("lammps", "example.lammps", null);
        client.cancelTask(id);

        RemoteExecutionException e = assertThrows(RemoteExecutionException.class,
                () -> client.waitForTask(id, Duration.ofSeconds(1)));
        assertEquals(TaskState.CANCELLED, e.getState());
    }

    @Test
    void interruptedWaitRestoresFlag() {
        TaskLifecycleClient c = new TaskLifecycleClient(PipelineContext.builder(queue)
                .sleeper(d -> {
                    throw new InterruptedException();
                })
                .build());
        String id = c.submitTask("lammps", "example.lammps", null);

        assertThrows(RuntimeException.class, () -> c.waitForTask(id, null));
        assertTrue(Thread.interrupted());
    }

    @Test
    void catalogAndHealthComeFromContext() {
        SimulationCatalog catalog = new SimulationCatalog(Map.of(
                "lammps", new SimulationTool("Molecular dynamics", List.of("example.lammps"))));
        TaskLifecycleClient c = new TaskLifecycleClient(PipelineContext.builder(queue).simulationCatalog(catalog).build());

        assertTrue(c.listAvailableSimulations().supports("lammps", "example.lammps"));
        assertTrue(c.healthCheck().healthy());
    }
}
