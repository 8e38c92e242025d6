package com.keystone.queue.temporal;

import com.keystone.config.KeystoneConfig;
import com.keystone.task.QueueHealth;
import com.keystone.task.SubmissionException;
import com.keystone.task.TaskPoll;
import com.keystone.task.TaskQueue;
import com.keystone.task.TaskSpec;
import com.keystone.task.TaskState;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.temporal.api.common.v1.WorkflowExecution;
import io.temporal.api.workflowservice.v1.DescribeNamespaceRequest;
import io.temporal.api.workflowservice.v1.DescribeWorkflowExecutionRequest;
import io.temporal.api.workflowservice.v1.DescribeWorkflowExecutionResponse;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.client.WorkflowException;
import io.temporal.client.WorkflowFailedException;
import io.temporal.client.WorkflowOptions;
import io.temporal.client.WorkflowStub;
import io.temporal.failure.ApplicationFailure;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TaskQueue} over a Temporal cluster. Each task is one {@link SimulationWorkflow} execution whose
 * workflow id is the task id. Polls describe the execution; results of completed executions are read
 * from the workflow result. Submitted specs are tracked locally so status reads can echo tool and script.
 */
public final class TemporalTaskQueue implements TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TemporalTaskQueue.class);

    static final String WORKFLOW_ID_PREFIX = "keystone-";

    private final WorkflowClient client;
    private final String namespace;
    private final String taskQueue;
    private final KeystoneConfig config;
    private final Map<String, TaskSpec> tracked = new ConcurrentHashMap<>();

    public TemporalTaskQueue(WorkflowClient client, KeystoneConfig config) {
        this.client = Objects.requireNonNull(client, "client");
        this.config = Objects.requireNonNull(config, "config");
        this.namespace = client.getOptions().getNamespace();
        this.taskQueue = config.getTaskQueue();
    }

    /** Connects to {@code config}'s Temporal target and namespace. */
    public static TemporalTaskQueue connect(KeystoneConfig config) {
        WorkflowServiceStubs service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                        .setTarget(config.getTemporalTarget())
                        .build()
        );
        WorkflowClient client = WorkflowClient.newInstance(
                service,
                WorkflowClientOptions.newBuilder()
                        .setNamespace(config.getTemporalNamespace())
                        .build()
        );
        log.info("Temporal queue | target: {} | namespace: {} | task queue: {}",
                config.getTemporalTarget(), config.getTemporalNamespace(), config.getTaskQueue());
        return new TemporalTaskQueue(client, config);
    }

    @Override
    public String submit(TaskSpec spec) {
        String workflowId = WORKFLOW_ID_PREFIX + UUID.randomUUID();
        WorkflowOptions.Builder options = WorkflowOptions.newBuilder()
                .setTaskQueue(taskQueue)
                .setWorkflowId(workflowId);
        if (config.getTaskTimeout() != null) {
            options.setWorkflowExecutionTimeout(config.getTaskTimeout());
        }
        SimulationWorkflow workflow = client.newWorkflowStub(SimulationWorkflow.class, options.build());
        try {
            WorkflowClient.start(workflow::run, SimulationRequest.from(spec));
        } catch (WorkflowException | StatusRuntimeException e) {
            throw new SubmissionException("Temporal rejected " + spec.tool() + "/" + spec.script() + ": " + e.getMessage(), e);
        }
        tracked.put(workflowId, spec);
        log.debug("Started workflow {} on task queue {}", workflowId, taskQueue);
        return workflowId;
    }

    @Override
    public TaskPoll poll(String taskId) {
        DescribeWorkflowExecutionResponse description = describe(taskId);
        TaskState state = TemporalStateMapper.toTaskState(
                description.getWorkflowExecutionInfo().getStatus(),
                description.getWorkflowExecutionInfo().getHistoryLength());
        TaskSpec spec = tracked.get(taskId);
        WorkflowStub stub = untypedStub(taskId);
        switch (state) {
            case SUCCESS:
                return new TaskPoll(state, 100, readResult(stub), null, spec);
            case FAILURE:
                return new TaskPoll(state, null, null, readFailure(stub), spec);
            case TIMEOUT:
                return new TaskPoll(state, null, null, "Workflow execution timed out", spec);
            case CANCELLED:
                return new TaskPoll(state, null, null, "Workflow " + description.getWorkflowExecutionInfo().getStatus(), spec);
            default:
                return new TaskPoll(state, state == TaskState.RUNNING ? queryProgress(stub) : null, null, null, spec);
        }
    }

    @Override
    public boolean cancel(String taskId) {
        try {
            if (poll(taskId).state().isTerminal()) {
                return false;
            }
            untypedStub(taskId).cancel();
            return true;
        } catch (IllegalArgumentException e) {
            log.warn("Cannot cancel unknown workflow {}", taskId);
            return false;
        } catch (WorkflowException e) {
            log.warn("Cancel of workflow {} rejected: {}", taskId, e.getMessage());
            return false;
        }
    }

    @Override
    public QueueHealth healthCheck() {
        try {
            client.getWorkflowServiceStubs().blockingStub()
                    .describeNamespace(DescribeNamespaceRequest.newBuilder().setNamespace(namespace).build());
            return QueueHealth.up("Temporal namespace " + namespace + " reachable");
        } catch (StatusRuntimeException e) {
            log.warn("Temporal health check failed: {}", e.getStatus());
            return QueueHealth.down("Temporal namespace " + namespace + ": " + e.getStatus().getCode());
        }
    }

    @Override
    public void clearTrackedTasks() {
        int n = tracked.size();
        tracked.clear();
        log.debug("Dropped {} tracked workflow handles", n);
    }

    private DescribeWorkflowExecutionResponse describe(String taskId) {
        DescribeWorkflowExecutionRequest request = DescribeWorkflowExecutionRequest.newBuilder()
                .setNamespace(namespace)
                .setExecution(WorkflowExecution.newBuilder().setWorkflowId(taskId).build())
                .build();
        try {
            return client.getWorkflowServiceStubs().blockingStub().describeWorkflowExecution(request);
        } catch (StatusRuntimeException e) {
            if (e.getStatus().getCode() == Status.Code.NOT_FOUND) {
                throw new IllegalArgumentException("Unknown task: " + taskId, e);
            }
            throw e;
        }
    }

    private WorkflowStub untypedStub(String taskId) {
        return client.newUntypedWorkflowStub(taskId, Optional.empty(), Optional.empty());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readResult(WorkflowStub stub) {
        Map<String, Object> result = stub.getResult(Map.class);
        return result != null ? result : Map.of();
    }

    private String readFailure(WorkflowStub stub) {
        try {
            stub.getResult(Map.class);
            return "Workflow failed";
        } catch (WorkflowFailedException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ApplicationFailure af) {
                return af.getOriginalMessage();
            }
            return cause != null ? cause.getMessage() : e.getMessage();
        }
    }

    private Integer queryProgress(WorkflowStub stub) {
        if (!config.isQueryProgress()) {
            return null;
        }
        try {
            return stub.query("progress", Integer.class);
        } catch (WorkflowException e) {
            log.debug("Progress query failed for {}: {}", stub.getExecution(), e.getMessage());
            return null;
        }
    }
}
