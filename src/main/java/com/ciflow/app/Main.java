package com.ciflow.app;

import com.ciflow.aggregate.PipelineResult;
import com.ciflow.artifact.ArtifactTransport;
import com.ciflow.artifact.InMemoryArtifactTransport;
import com.ciflow.core.RunContext;
import com.ciflow.db.ArtifactRepository;
import com.ciflow.db.Database;
import com.ciflow.definition.PipelineDefinition;
import com.ciflow.definition.PipelineLoader;
import com.ciflow.engine.PipelineRun;
import com.ciflow.engine.Scheduler;
import com.ciflow.executors.ScriptedExecutor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command line entry point: loads a pipeline, triggers one run with the scripted executor and
 * serves its checks.
 *
 * <pre>
 * java com.ciflow.app.Main [pipeline.json] [event] [branch] [changed paths...]
 * </pre>
 * Without arguments the bundled {@code pipelines/l1.json} runs for a push to {@code main}.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());
    private static final String DEFAULT_PIPELINE = "pipelines/l1.json";

    private static EngineConfig config;
    private static Database database;
    private static Scheduler scheduler;
    private static CheckStatusServer statusServer;

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== CI Pipeline Engine Starting ===");

        try {
            // 1. Configuration
            config = EngineConfig.load();
            logger.info("Configuration: " + config);

            // 2. Pipeline definition
            PipelineDefinition definition = loadDefinition(args);

            // 3. Artifact transport, database when configured
            ArtifactTransport transport = initializeArtifacts();

            // 4. Scheduler
            initializeScheduler(transport);

            // 5. Check status server
            initializeStatusServer();

            addShutdownHook();

            RunContext context = runContext(args);
            Optional<PipelineRun> run = scheduler.trigger(definition, context);
            if (run.isEmpty()) {
                logger.info("No trigger of " + definition.getName() + " matched; nothing to run");
                shutdown();
                return;
            }

            PipelineResult result = run.get().getCompletion().get();
            logger.info("Run " + result.getRunId() + " finished with " + result.getStatus());

            if (statusServer == null) {
                shutdown();
                System.exit(result.isSuccess() ? 0 : 1);
            }
            logger.info("Checks available at http://localhost:" + statusServer.getPort() + "/runs/"
                    + result.getRunId() + " - press Ctrl+C to stop");
            Thread.currentThread().join();

        } catch (InterruptedException e) {
            logger.info("Main thread interrupted");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error", e);
            System.exit(2);
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to read logging.properties", e);
        }
    }

    private static PipelineDefinition loadDefinition(String[] args) throws IOException {
        PipelineLoader loader = new PipelineLoader();
        if (args.length > 0) {
            logger.info("Loading pipeline " + args[0]);
            return loader.load(Path.of(args[0]));
        }
        logger.info("Loading bundled pipeline " + DEFAULT_PIPELINE);
        return loader.loadResource(DEFAULT_PIPELINE);
    }

    private static RunContext runContext(String[] args) {
        String event = args.length > 1 ? args[1] : "push";
        String branch = args.length > 2 ? args[2] : "main";
        RunContext.Builder builder = RunContext.builder()
                .trigger(event)
                .branch(branch)
                .actor(System.getProperty("user.name", "ciflow"));
        if ("pull_request".equals(event)) {
            builder.headRef(branch);
        }
        if (args.length > 3) {
            builder.changedPaths(Arrays.asList(args).subList(3, args.length));
        }
        return builder.build();
    }

    private static ArtifactTransport initializeArtifacts() {
        if (config.getArtifacts() != EngineConfig.ArtifactBackend.H2) {
            return new InMemoryArtifactTransport();
        }
        try {
            database = new Database(config.getJdbcUrl());
            database.initialize();
            return new ArtifactRepository(database);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize database", e);
            throw new RuntimeException("Database initialization failed", e);
        }
    }

    private static void initializeScheduler(ArtifactTransport transport) {
        scheduler = new Scheduler(config.getWorkers(), config.getDefaultTimeout(), new ScriptedExecutor(),
                transport, new LoggingNotifier(LoggingNotifier.Mode.ALWAYS));
        scheduler.startInBackground();
        logger.info("Scheduler started with " + config.getWorkers() + " workers");
    }

    private static void initializeStatusServer() {
        if (config.getStatusPort() <= 0) {
            return;
        }
        try {
            statusServer = new CheckStatusServer(scheduler, config.getStatusPort());
            statusServer.start();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to start check status server", e);
            throw new RuntimeException("Check status server initialization failed", e);
        }
    }

    private static void addShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(Main::shutdown, "Shutdown-Hook"));
    }

    private static synchronized void shutdown() {
        if (statusServer != null) {
            statusServer.stop();
            statusServer = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
        if (database != null) {
            database.close();
        }
    }
}
