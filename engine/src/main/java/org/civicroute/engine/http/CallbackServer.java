package org.civicroute.engine.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.civicroute.engine.cache.HandlingUnitRegistry;
import org.civicroute.engine.domain.model.Assignment;
import org.civicroute.engine.domain.model.WorkloadReport;
import org.civicroute.engine.domain.service.AssignmentCoordinator;
import org.civicroute.engine.exception.InvalidItemStateException;
import org.civicroute.engine.exception.NotFoundException;
import org.civicroute.engine.exception.PersistenceException;
import org.civicroute.engine.exception.RegistryLoadException;
import org.civicroute.engine.exception.WorkloadQueryException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP server for engine callbacks from the API.
 * Exposes the engine surface: assignment triggers, registry refresh and workload diagnostics.
 */
public final class CallbackServer {

    private static final Logger LOG = Logger.getLogger(CallbackServer.class.getName());

    private final HttpServer server;
    private final ExecutorService executor;
    private final HandlingUnitRegistry registry;
    private final AssignmentCoordinator coordinator;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Route handler that produces a status code and a JSON-serializable body.
     */
    private interface Action {
        Reply handle(String pathParam) throws IOException;
    }

    private static final class Reply {
        private final int status;
        private final Object body;

        private Reply(int status, Object body) {
            this.status = status;
            this.body = body;
        }
    }

    public CallbackServer(int port, HandlingUnitRegistry registry, AssignmentCoordinator coordinator) throws IOException {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator must not be null");

        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4);
        this.server.setExecutor(executor);

        registerHandlers();
        LOG.info(() -> "Callback server initialized on port " + getPort());
    }

    private void registerHandlers() {
        register("/health", "GET", false, p -> handleHealth());
        register("/refresh", "POST", false, p -> handleRefresh());
        register("/assign/", "POST", true, this::handleAssign);
        register("/reassign/", "POST", true, this::handleReassign);
        register("/unassign/", "POST", true, this::handleUnassign);
        register("/workload/", "GET", true, this::handleWorkload);
    }

    /**
     * Start the callback server.
     */
    public void start() {
        server.start();
        LOG.info("Callback server started");
    }

    /**
     * Stop the callback server.
     */
    public void stop() {
        server.stop(1);
        executor.shutdownNow();
        LOG.info("Callback server stopped");
    }

    /**
     * Bound port; differs from the requested one when 0 was passed.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * GET /health
     */
    private Reply handleHealth() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", registry.isInitialized() ? "healthy" : "initializing");
        body.put("units", registry.snapshot().size());
        body.put("snapshotLoadedAt", registry.snapshot().getLoadedAt().toString());
        return new Reply(200, body);
    }

    /**
     * POST /refresh
     */
    private Reply handleRefresh() {
        LOG.info("Received refresh request");
        if (coordinator.refreshRegistry()) {
            return new Reply(200, Collections.singletonMap("status", "refreshed"));
        }
        return new Reply(503, Collections.singletonMap("error", "refresh failed, previous snapshot retained"));
    }

    /**
     * POST /assign/{itemId}
     */
    private Reply handleAssign(String itemId) {
        LOG.info(() -> "Received assign request for item: " + itemId);
        return assignmentReply(coordinator.assignItem(itemId));
    }

    /**
     * POST /reassign/{itemId}
     */
    private Reply handleReassign(String itemId) {
        LOG.info(() -> "Received reassign request for item: " + itemId);
        return assignmentReply(coordinator.forceReassign(itemId));
    }

    /**
     * POST /unassign/{itemId}
     */
    private Reply handleUnassign(String itemId) {
        LOG.info(() -> "Received unassign request for item: " + itemId);
        return new Reply(200, Collections.singletonMap("unassigned", coordinator.unassignItem(itemId)));
    }

    /**
     * GET /workload/{unitId}
     */
    private Reply handleWorkload(String unitId) {
        WorkloadReport report = coordinator.getWorkload(unitId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("unitId", report.getUnitId());
        body.put("openCount", report.getOpenCount());
        body.put("maxConcurrentItems", report.getMaxConcurrentItems());
        body.put("workloadRatio", Double.isInfinite(report.getWorkloadRatio()) ? null : report.getWorkloadRatio());
        body.put("overCapacity", report.isOverCapacity());
        return new Reply(200, body);
    }

    private static Reply assignmentReply(Assignment assignment) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("assigned", assignment != null);
        if (assignment != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("itemId", assignment.getItemId());
            details.put("unitId", assignment.getUnitId());
            details.put("unitName", assignment.getUnitName());
            details.put("staffId", assignment.getStaffId());
            details.put("assignedAt", assignment.getAssignedAt().toString());
            details.put("autoAssigned", assignment.isAutoAssigned());
            body.put("assignment", details);
        }
        return new Reply(200, body);
    }

    private void register(String context, String method, boolean requiresParam, Action action) {
        server.createContext(context, exchange -> {
            try {
                if (!method.equals(exchange.getRequestMethod())) {
                    sendResponse(exchange, 405, Collections.singletonMap("error", "method not allowed"));
                    return;
                }

                String param = null;
                if (requiresParam) {
                    param = extractPathParam(exchange.getRequestURI().getPath(), context);
                    if (param == null || param.isEmpty()) {
                        sendResponse(exchange, 400, Collections.singletonMap("error", "missing identifier"));
                        return;
                    }
                }

                Reply reply = action.handle(param);
                sendResponse(exchange, reply.status, reply.body);
            } catch (NotFoundException e) {
                sendResponse(exchange, 404, Collections.singletonMap("error", e.getMessage()));
            } catch (InvalidItemStateException e) {
                sendResponse(exchange, 409, Collections.singletonMap("error", e.getMessage()));
            } catch (WorkloadQueryException | PersistenceException | RegistryLoadException e) {
                LOG.log(Level.WARNING, e, () -> "Request failed: " + exchange.getRequestURI());
                sendResponse(exchange, 503, Collections.singletonMap("error", e.getMessage()));
            } catch (IllegalArgumentException e) {
                sendResponse(exchange, 400, Collections.singletonMap("error", e.getMessage()));
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, e, () -> "Request failed: " + exchange.getRequestURI());
                sendResponse(exchange, 500, Collections.singletonMap("error", "internal error"));
            }
        });
    }

    /**
     * Extract the single path segment following the context prefix.
     */
    static String extractPathParam(String path, String context) {
        if (path == null || !path.startsWith(context)) {
            return null;
        }
        String rest = path.substring(context.length());
        int slash = rest.indexOf('/');
        if (slash >= 0) {
            rest = rest.substring(0, slash);
        }
        return rest.trim();
    }

    private void sendResponse(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            LOG.log(Level.SEVERE, "Failed to serialize response", e);
            statusCode = 500;
            bytes = "{\"error\":\"serialization failed\"}".getBytes(StandardCharsets.UTF_8);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
