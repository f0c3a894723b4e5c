package com.ciflow.app;

import com.ciflow.aggregate.CheckResult;
import com.ciflow.aggregate.PipelineResult;
import com.ciflow.core.JobStatus;
import com.ciflow.engine.PipelineRun;
import com.ciflow.engine.Scheduler;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONObject;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP server exposing run results and required-check signals to external gates.
 *
 * <p><b>Endpoints:</b></p>
 * <ul>
 *   <li>{@code GET /runs/{runId}}: the result JSON, or the live job table while the run is in progress</li>
 *   <li>{@code GET /runs/{runId}/checks/{name}}: {@code pass}, {@code fail} or {@code pending}</li>
 *   <li>{@code GET /health}: scheduler counters</li>
 * </ul>
 */
public class CheckStatusServer {
    private static final Logger logger = Logger.getLogger(CheckStatusServer.class.getName());

    private final Scheduler scheduler;
    private final int port;
    private final long startTime;
    private HttpServer server;
    private ExecutorService requestExecutor;

    /**
     * @param scheduler the scheduler whose runs are served
     * @param port      port to bind, 0 for any free port
     */
    public CheckStatusServer(Scheduler scheduler, int port) {
        this.scheduler = scheduler;
        this.port = port;
        this.startTime = System.currentTimeMillis();
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/runs/", new RunsHandler());
        server.createContext("/health", new HealthHandler());

        requestExecutor = Executors.newFixedThreadPool(4);
        server.setExecutor(requestExecutor);
        server.start();

        logger.info("Check status server started on port " + getPort());
    }

    public void stop() {
        if (server != null) {
            server.stop(1);
            requestExecutor.shutdownNow();
            logger.info("Check status server stopped");
        }
    }

    /**
     * @return the bound port, useful when started on port 0
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    // /runs/{id} and /runs/{id}/checks/{name}
    private class RunsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            try {
                String[] segments = exchange.getRequestURI().getPath().substring("/runs/".length()).split("/");
                if (segments.length == 1 && !segments[0].isEmpty()) {
                    serveRun(exchange, segments[0]);
                } else if (segments.length == 3 && "checks".equals(segments[1])) {
                    serveCheck(exchange, segments[0], segments[2]);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Unexpected error handling request", e);
                sendError(exchange, 500, "Internal Server Error");
            }
        }

        private void serveRun(HttpExchange exchange, String runId) throws IOException {
            PipelineResult result = scheduler.getResult(runId);
            if (result != null) {
                sendJson(exchange, 200, result.toJson());
                return;
            }
            PipelineRun run = scheduler.getRun(runId);
            if (run == null) {
                sendError(exchange, 404, "Unknown run " + runId);
                return;
            }

            JSONObject json = new JSONObject();
            json.put("runId", runId);
            json.put("pipeline", run.getDefinition().getName());
            json.put("status", run.isAdmitted() ? "in_progress" : "queued");
            JSONObject jobs = new JSONObject();
            for (Map.Entry<String, JobStatus> entry : run.getStatuses().entrySet()) {
                jobs.put(entry.getKey(), new JSONObject().put("result", entry.getValue().getResultName()));
            }
            json.put("jobs", jobs);
            sendJson(exchange, 200, json);
        }

        private void serveCheck(HttpExchange exchange, String runId, String name) throws IOException {
            PipelineResult result = scheduler.getResult(runId);
            if (result != null) {
                CheckResult check = result.getCheck(name);
                if (check == null) {
                    sendError(exchange, 404, "Run " + runId + " has no check " + name);
                    return;
                }
                JSONObject json = new JSONObject();
                json.put("runId", runId);
                json.put("name", name);
                json.put("conclusion", check.getConclusion().name().toLowerCase());
                json.put("result", check.getStatus().getResultName());
                if (check.getReason() != null) {
                    json.put("reason", check.getReason());
                }
                sendJson(exchange, 200, json);
                return;
            }

            PipelineRun run = scheduler.getRun(runId);
            if (run == null) {
                sendError(exchange, 404, "Unknown run " + runId);
                return;
            }
            if (run.getDefinition().getJob(name) == null) {
                sendError(exchange, 404, "Run " + runId + " has no check " + name);
                return;
            }
            JSONObject json = new JSONObject();
            json.put("runId", runId);
            json.put("name", name);
            json.put("conclusion", "pending");
            sendJson(exchange, 200, json);
        }
    }

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            JSONObject json = new JSONObject();
            json.put("status", scheduler.isRunning() ? "UP" : "DOWN");
            json.put("uptime_seconds", (System.currentTimeMillis() - startTime) / 1000);
            json.put("scheduler", new JSONObject(scheduler.getStatus()));
            sendJson(exchange, 200, json);
        }
    }

    private static void sendJson(HttpExchange exchange, int statusCode, JSONObject json) throws IOException {
        byte[] response = json.toString().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    private static void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        sendJson(exchange, statusCode, new JSONObject().put("error", message));
    }
}
