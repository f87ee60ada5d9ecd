package org.civicroute.engine;

import org.civicroute.engine.api.ExternalCallExecutor;
import org.civicroute.engine.api.RestCivicApiClient;
import org.civicroute.engine.cache.HandlingUnitRegistry;
import org.civicroute.engine.cache.HandlingUnitRegistryImpl;
import org.civicroute.engine.config.EngineConfig;
import org.civicroute.engine.domain.service.AssignmentCoordinator;
import org.civicroute.engine.domain.service.AssignmentCoordinatorImpl;
import org.civicroute.engine.domain.service.LeastLoadedStaffSelector;
import org.civicroute.engine.domain.service.ScoringService;
import org.civicroute.engine.domain.service.ScoringServiceImpl;
import org.civicroute.engine.http.CallbackServer;
import org.civicroute.engine.scheduler.RegistryRefreshScheduler;
import org.civicroute.engine.workload.RepositoryWorkloadTracker;
import org.civicroute.engine.workload.WorkloadTracker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Main entry point for the Routing Engine.
 *
 * The engine routes newly reported issues to the best matching department and,
 * when one is available, to its least busy staff member.
 *
 * Trigger modes:
 * - On issue creation: API calls POST /assign/{itemId}
 * - Operator re-routing: API calls POST /reassign/{itemId}
 * - Registry: refreshed every N seconds, or on POST /refresh
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Engine startup failed", e);
            System.exit(1);
        }
    }

    private void run() throws Exception {
        LOG.info("=== Civic Route Engine ===");

        // Load configuration
        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);
        LOG.info(() -> "Routing weights: " + config.getRoutingConfig());

        configureLogging(config);

        RestCivicApiClient apiClient = new RestCivicApiClient(
                config.getApiBaseUrl(), config.getApiToken(), config.getExternalQueryTimeout());
        LOG.info(() -> "API client configured for: " + config.getApiBaseUrl());

        ExternalCallExecutor calls = new ExternalCallExecutor(
                config.getWorkloadQueryThreads(), config.getExternalQueryTimeout());

        // Create registry and load units
        HandlingUnitRegistry registry = new HandlingUnitRegistryImpl(apiClient, calls, Clock.systemUTC());
        LOG.info("Loading handling units from API...");
        if (!registry.refresh()) {
            LOG.warning("Registry not initialized, assignment requests will fail until a refresh succeeds");
        }

        // Create services
        WorkloadTracker workloadTracker = new RepositoryWorkloadTracker(
                apiClient, calls, config.getWorkloadFailurePolicy());
        ScoringService scoringService = new ScoringServiceImpl(config.getRoutingConfig());
        AssignmentCoordinator coordinator = new AssignmentCoordinatorImpl.Builder()
                .itemRepository(apiClient)
                .registry(registry)
                .workloadTracker(workloadTracker)
                .scoringService(scoringService)
                .staffSelector(new LeastLoadedStaffSelector(workloadTracker))
                .notificationSink(apiClient)
                .eventPublisher(apiClient)
                .calls(calls)
                .conflictRetries(config.getConflictRetries())
                .build();

        // Start callback server
        CallbackServer callbackServer = new CallbackServer(config.getCallbackPort(), registry, coordinator);
        callbackServer.start();
        LOG.info(() -> "Callback server started on port " + callbackServer.getPort());

        // Start registry refresh timer if enabled
        RegistryRefreshScheduler scheduler = null;
        if (config.isRegistrySchedulerEnabled()) {
            scheduler = new RegistryRefreshScheduler(registry,
                    Duration.ofSeconds(config.getRegistryRefreshIntervalSeconds()));
            scheduler.start();
        } else {
            LOG.info("Registry refresh scheduler disabled");
        }

        // Register shutdown hook
        final RegistryRefreshScheduler finalScheduler = scheduler;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down engine...");
            callbackServer.stop();
            if (finalScheduler != null) {
                finalScheduler.stop();
            }
            calls.close();
            LOG.info("Engine shutdown complete");
        }));

        LOG.info("=== Routing Engine started successfully ===");
        LOG.info("Endpoints:");
        LOG.info(() -> "  - Health: GET http://localhost:" + callbackServer.getPort() + "/health");
        LOG.info(() -> "  - Refresh: POST http://localhost:" + callbackServer.getPort() + "/refresh");
        LOG.info(() -> "  - Assign: POST http://localhost:" + callbackServer.getPort() + "/assign/{itemId}");
        LOG.info(() -> "  - Reassign: POST http://localhost:" + callbackServer.getPort() + "/reassign/{itemId}");
        LOG.info(() -> "  - Unassign: POST http://localhost:" + callbackServer.getPort() + "/unassign/{itemId}");
        LOG.info(() -> "  - Workload: GET http://localhost:" + callbackServer.getPort() + "/workload/{unitId}");

        // Keep main thread alive
        Thread.currentThread().join();
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        String logFilePath = config.getLogFilePath();
        Path target = Paths.get(logFilePath).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
