package com.keystone.queue.temporal;

import io.temporal.workflow.QueryMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

import java.util.Map;

/**
 * Simulation workflow executed by the worker pool. Only the interface lives here; the
 * implementation is registered by the workers.
 */
@WorkflowInterface
public interface SimulationWorkflow {

    /**
     * Runs one simulation script.
     *
     * @return result map; {@code duration_seconds} is read by workflow statistics
     */
    @WorkflowMethod
    Map<String, Object> run(SimulationRequest request);

    /** Progress percentage 0..100, when the worker reports it. */
    @QueryMethod
    Integer progress();
}
