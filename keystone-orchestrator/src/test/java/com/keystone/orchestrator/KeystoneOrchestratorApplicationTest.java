package com.keystone.orchestrator;

import com.keystone.config.KeystoneConfig;
import com.keystone.config.KeystoneSettings;
import com.keystone.config.RoutingDefaults;
import com.keystone.config.SimulationCatalog;
import com.keystone.config.SimulationTool;
import com.keystone.pipeline.PipelineContext;
import com.keystone.task.memory.InMemoryTaskQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeystoneOrchestratorApplicationTest {

    @TempDir
    Path tempDir;

    private InMemoryTaskQueue queue;
    private KeystoneBootstrap bootstrap;
    private ByteArrayOutputStream buffer;
    private KeystoneOrchestratorApplication app;

    @BeforeEach
    void setUp() {
        queue = new InMemoryTaskQueue();
        queue.setSubmitListener((id, spec) -> queue.complete(id, Map.of("duration_seconds", 2.0)));
        KeystoneSettings settings = new KeystoneSettings("1.0", RoutingDefaults.defaults(),
                new SimulationCatalog(Map.of("lammps", new SimulationTool("Molecular dynamics", List.of("example.lammps")))));
        KeystoneConfig config = KeystoneConfig.fromEnvironment(Map.of());
        bootstrap = KeystoneBootstrap.create(config, settings,
                PipelineContext.fromConfig(config, queue, settings.getSimulations()));
        buffer = new ByteArrayOutputStream();
        app = new KeystoneOrchestratorApplication(bootstrap, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        bootstrap.close();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void simulationsPrintsCatalog() {
        assertEquals(KeystoneOrchestratorApplication.EXIT_OK, app.execute(new String[]{"simulations"}));
        assertTrue(output().contains("example.lammps"));
    }

    @Test
    void healthReportsInMemoryQueueUp() {
        assertEquals(KeystoneOrchestratorApplication.EXIT_OK, app.execute(new String[]{"health"}));
        assertTrue(output().contains("\"healthy\" : true"));
    }

    @Test
    void runDrivesPlanFile() throws Exception {
        Path plan = Files.writeString(tempDir.resolve("plan.json"), """
                {"name":"md","steps":[
                  {"id":"equilibrate","tool":"lammps","script":"example.lammps"},
                  {"id":"produce","tool":"lammps","script":"example.lammps","params":{"steps":1000}}
                ]}
                """);

        assertEquals(KeystoneOrchestratorApplication.EXIT_OK, app.execute(new String[]{"run", plan.toString()}));
        assertEquals(2, queue.submittedIds().size());
        assertTrue(output().contains("\"succeeded\" : true"));
        assertTrue(output().contains("success_path"));
    }

    @Test
    void sweepWaitsAndReportsStats() throws Exception {
        Path grid = Files.writeString(tempDir.resolve("grid.json"), "{\"temperature\":[1.0,1.5],\"density\":[0.8]}");

        assertEquals(KeystoneOrchestratorApplication.EXIT_OK,
                app.execute(new String[]{"sweep", "lammps", "example.lammps", grid.toString()}));
        assertEquals(2, queue.submittedIds().size());
        assertTrue(output().contains("\"speedup\" : 2.0"));
    }

    @Test
    void statusReadsEveryTaskOnTheLocalPool() {
        String first = bootstrap.getClient().submitTask("lammps", "example.lammps", Map.of());
        String second = bootstrap.getClient().submitTask("lammps", "example.lammps", Map.of("steps", 10));

        assertEquals(KeystoneOrchestratorApplication.EXIT_OK, app.execute(new String[]{"status", first, second}));
        String printed = output();
        assertTrue(printed.indexOf(first) < printed.indexOf(second));
        assertTrue(printed.contains("\"state\" : \"SUCCESS\""));
        assertEquals(KeystoneConfig.fromEnvironment(Map.of()).getExecutorWorkers(),
                bootstrap.getBatchProcessor().getMaxWorkers());
    }

    @Test
    void statusFailsWhenAnyTaskFailed() {
        queue.setSubmitListener((id, spec) -> queue.fail(id, "segfault"));
        String failed = bootstrap.getClient().submitTask("lammps", "example.lammps", Map.of());

        assertEquals(KeystoneOrchestratorApplication.EXIT_FAILED, app.execute(new String[]{"status", failed}));
        assertTrue(output().contains("segfault"));
    }

    @Test
    void badArgumentsAreUsageErrors() {
        assertEquals(KeystoneOrchestratorApplication.EXIT_USAGE, app.execute(new String[]{"launch"}));
        assertEquals(KeystoneOrchestratorApplication.EXIT_USAGE, app.execute(new String[]{"run"}));
        assertEquals(KeystoneOrchestratorApplication.EXIT_USAGE, app.execute(new String[]{"status"}));
    }

    @Test
    void missingPlanFileFails() {
        assertEquals(KeystoneOrchestratorApplication.EXIT_FAILED,
                app.execute(new String[]{"run", tempDir.resolve("absent.json").toString()}));
    }
}
