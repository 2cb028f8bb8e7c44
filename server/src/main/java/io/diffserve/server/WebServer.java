// file: server/src/main/java/io/diffserve/server/WebServer.java
package io.diffserve.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.diffserve.server.dto.InjectRequest;
import io.diffserve.server.dto.InjectResponse;
import io.diffserve.server.dto.PullRequest;
import io.diffserve.server.dto.PullResponse;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Thin HTTP adapter over SyncService.
 *
 * Responsibilities:
 *  - Route by path, reject unsupported methods.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /pull            Sync a client to its latest state
 *   - POST /inject          Store a client view directly (only with --enable-inject, else 404)
 *   - GET  /admin/health    Basic health check
 *
 * Every request runs on an Undertow worker thread (BlockingHandler), so storage and
 * upstream I/O never block the IO threads.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final SyncService sync;
    private final boolean enableInject;

    public WebServer(int port, SyncService sync, boolean enableInject) {
        this.sync = sync;
        this.enableInject = enableInject;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(new BlockingHandler(this::route))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void route(HttpServerExchange exchange) {
        var path = exchange.getRequestPath();
        var method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        switch (path) {
            case "/pull" -> {
                if ("POST".equals(method)) {
                    handlePull(exchange);
                } else {
                    unsupportedMethod(exchange, method, path);
                }
            }
            case "/inject" -> {
                if (!enableInject) {
                    send(exchange, 404, Map.of("error", "not found"));
                    RequestLogger.logRequest(method, path, 404, 0, -1, null);
                } else if ("POST".equals(method)) {
                    handleInject(exchange);
                } else {
                    unsupportedMethod(exchange, method, path);
                }
            }
            case "/admin/health" -> {
                send(exchange, 200, Map.of("status", "ok"));
                RequestLogger.logRequest(method, path, 200, 0, -1, null);
            }
            default -> {
                send(exchange, 404, Map.of("error", "not found"));
                RequestLogger.logRequest(method, path, 404, 0, -1, null);
            }
        }
    }

    // ---------- handlers ----------

    /** POST /pull */
    private void handlePull(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        long start = System.nanoTime();
        int status;
        long serviceMs = -1L;
        Throwable error = null;

        try {
            byte[] data = ex.getInputStream().readAllBytes();
            if (data.length > MAX_BODY_BYTES) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
            } else {
                JsonNode body = json.readTree(data);
                PullRequest req = PullRequest.fromJson(body);
                String auth = ex.getRequestHeaders().getFirst(Headers.AUTHORIZATION);

                long sStart = System.nanoTime();
                PullResponse resp = sync.pull(req, auth);
                serviceMs = (System.nanoTime() - sStart) / 1_000_000L;

                status = 200;
                send(ex, status, resp);
            }
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", bad.getMessage()));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "Bad request payload"));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, serverError(e));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest("POST", path, ex.getStatusCode(), totalMs, serviceMs, error);
    }

    /** POST /inject */
    private void handleInject(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        long start = System.nanoTime();
        int status;
        long serviceMs = -1L;
        Throwable error = null;

        try {
            byte[] data = ex.getInputStream().readAllBytes();
            if (data.length > MAX_BODY_BYTES) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
            } else {
                InjectRequest req = json.readValue(data, InjectRequest.class);
                if (req == null) {
                    throw new IllegalArgumentException("Bad request payload");
                }

                long sStart = System.nanoTime();
                InjectResponse resp = sync.inject(req);
                serviceMs = (System.nanoTime() - sStart) / 1_000_000L;

                status = 200;
                send(ex, status, resp);
            }
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", bad.getMessage()));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "Bad request payload"));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, serverError(e));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest("POST", path, ex.getStatusCode(), totalMs, serviceMs, error);
    }

    private void unsupportedMethod(HttpServerExchange ex, String method, String path) {
        send(ex, 405, Map.of("error", "Unsupported method: " + method));
        RequestLogger.logRequest(method, path, 405, 0, -1, null);
    }

    // ---------- helpers ----------

    private static Map<String, String> serverError(Exception e) {
        return Map.of(
                "error", e.getClass().getSimpleName(),
                "message", String.valueOf(e.getMessage())
        );
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (IOException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
