package com.keystone.orchestrator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.keystone.config.ConfigurationException;
import com.keystone.orchestrator.plan.WorkflowPlan;
import com.keystone.parallel.MapExecutionException;
import com.keystone.pipeline.ParallelExecutionStats;
import com.keystone.pipeline.WorkflowStatusView;
import com.keystone.task.QueueHealth;
import com.keystone.task.SubmissionException;
import com.keystone.task.TaskStatus;
import com.keystone.task.TaskTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 * <pre>
 *   run &lt;plan.json&gt;                       drive a workflow plan through the router
 *   sweep &lt;tool&gt; &lt;script&gt; &lt;grid.json&gt;  submit a parameter sweep and wait for it
 *   status &lt;taskId&gt;...                     read task statuses concurrently on the local pool
 *   health                                 check queue reachability
 *   simulations                            list the simulation catalog
 * </pre>
 * Results are printed as JSON on stdout; the exit code is 0 on success, 1 on failure, 2 on usage errors.
 */
public final class KeystoneOrchestratorApplication {

    private static final Logger log = LoggerFactory.getLogger(KeystoneOrchestratorApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final KeystoneBootstrap bootstrap;
    private final ObjectMapper mapper;
    private final PrintStream out;

    KeystoneOrchestratorApplication(KeystoneBootstrap bootstrap, PrintStream out) {
        this.bootstrap = bootstrap;
        this.mapper = newObjectMapper();
        this.out = out;
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            usage();
            System.exit(EXIT_USAGE);
        }
        int code;
        try (KeystoneBootstrap bootstrap = KeystoneBootstrap.initialize()) {
            code = new KeystoneOrchestratorApplication(bootstrap, System.out).execute(args);
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage(), e);
            code = EXIT_FAILED;
        }
        System.exit(code);
    }

    static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    int execute(String[] args) {
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        try {
            switch (command) {
                case "run":
                    return rest.size() == 1 ? run(Path.of(rest.get(0))) : usage();
                case "sweep":
                    return rest.size() == 3 ? sweep(rest.get(0), rest.get(1), Path.of(rest.get(2))) : usage();
                case "status":
                    return rest.isEmpty() ? usage() : status(rest);
                case "health":
                    return health();
                case "simulations":
                    print(bootstrap.getClient().listAvailableSimulations());
                    return EXIT_OK;
                default:
                    return usage();
            }
        } catch (ConfigurationException | SubmissionException | TaskTimeoutException | MapExecutionException e) {
            log.error("{} failed: {}", command, e.getMessage(), e);
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted", command);
            return EXIT_FAILED;
        }
    }

    private int run(Path planFile) throws InterruptedException {
        WorkflowPlan plan = WorkflowPlan.load(planFile, mapper);
        RunReport report = bootstrap.newStepRunner().run(plan);
        print(report);
        return report.succeeded() ? EXIT_OK : EXIT_FAILED;
    }

    private int sweep(String tool, String script, Path gridFile) {
        Map<String, List<Object>> grid;
        try {
            grid = mapper.readValue(Files.readString(gridFile), new TypeReference<Map<String, List<Object>>>() { });
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read parameter grid " + gridFile + ": " + e.getMessage(), e);
        }
        List<String> ids = bootstrap.getAggregator().parameterSweep(tool, script, grid,
                p -> log.info("Sweep {}/{} submitted {} {}", p.index() + 1, p.total(), p.taskId(), p.params()));
        WorkflowStatusView view = bootstrap.getAggregator().waitForWorkflow(ids, bootstrap.getConfig().getTaskTimeout(),
                v -> log.info("Sweep progress: {} completed, {} failed, {} running, {} pending",
                        v.completed(), v.failed(), v.running(), v.pending()), null);
        ParallelExecutionStats stats = bootstrap.getAggregator().getParallelExecutionStats(ids);
        print(Map.of("status", view, "stats", stats));
        return view.failed() == 0 ? EXIT_OK : EXIT_FAILED;
    }

    private int status(List<String> taskIds) {
        List<TaskStatus> statuses = bootstrap.getBatchProcessor()
                .batchExecute(bootstrap.getClient()::getTaskStatus, taskIds, null);
        print(statuses);
        return statuses.stream().anyMatch(TaskStatus::isFailed) ? EXIT_FAILED : EXIT_OK;
    }

    private int health() {
        QueueHealth health = bootstrap.getClient().healthCheck();
        print(health);
        return health.healthy() ? EXIT_OK : EXIT_FAILED;
    }

    private void print(Object value) {
        try {
            out.println(mapper.writeValueAsString(value));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize output", e);
        }
    }

    private static int usage() {
        System.err.println("usage: keystone run <plan.json> | sweep <tool> <script> <grid.json> | status <taskId>... | health | simulations");
        return EXIT_USAGE;
    }
}
