package com.mailroute.gateway.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mailroute.gateway.store.ProviderStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP health check server.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /health}: 200 while the gateway is running, 503 during
 *       shutdown.</li>
 *   <li>{@code GET /health/live}: liveness probe (always 200 if the JVM is alive).</li>
 *   <li>{@code GET /health/ready}: readiness probe (200 once the consumer is subscribed).</li>
 *   <li>{@code GET /health/providers}: counters and send eligibility of every
 *       provider. Never includes configuration or credentials.</li>
 *   <li>{@code POST /health/providers/{id}/reset}: clears the provider's
 *       consecutive failures.</li>
 * </ul>
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private static final String PROVIDERS_PATH = "/health/providers";
    private static final String RESET_SUFFIX   = "/reset";

    private final HttpServer            server;
    private final ProviderStore         store;
    private final ProviderHealthTracker tracker;
    private final ObjectMapper          mapper = new ObjectMapper();
    private final AtomicBoolean         ready  = new AtomicBoolean(false);

    public HealthServer(final int port, final ProviderStore store, final ProviderHealthTracker tracker) throws IOException {
        this.store   = store;
        this.tracker = tracker;
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.setExecutor(Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        }));

        server.createContext("/health",       this::handleHealth);
        server.createContext("/health/live",  this::handleLive);
        server.createContext("/health/ready", this::handleReady);
        server.createContext(PROVIDERS_PATH,  this::handleProviders);
    }

    public void start() {
        server.start();
        LOG.info("Health server started on port {}", getPort());
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int getPort() {
        return server.getAddress().getPort();
    }

    /** Mark the gateway as ready to receive traffic. */
    public void markReady() {
        ready.set(true);
        LOG.info("Gateway marked as ready");
    }

    /** Mark the gateway as not ready (e.g. during shutdown). */
    public void markNotReady() {
        ready.set(false);
    }

    public void stop() {
        markNotReady();
        server.stop(1);
        LOG.info("Health server stopped");
    }

    private void handleHealth(final HttpExchange exchange) throws IOException {
        respond(exchange, ready.get() ? 200 : 503,
                ready.get() ? "{\"status\":\"UP\"}" : "{\"status\":\"DOWN\"}");
    }

    private void handleLive(final HttpExchange exchange) throws IOException {
        respond(exchange, 200, "{\"status\":\"ALIVE\"}");
    }

    private void handleReady(final HttpExchange exchange) throws IOException {
        respond(exchange, ready.get() ? 200 : 503,
                ready.get() ? "{\"status\":\"READY\"}" : "{\"status\":\"NOT_READY\"}");
    }

    private void handleProviders(final HttpExchange exchange) throws IOException {
        final String path   = exchange.getRequestURI().getPath();
        final String method = exchange.getRequestMethod();

        if (path.equals(PROVIDERS_PATH) && "GET".equals(method)) {
            final ArrayNode rows = mapper.createArrayNode();
            for (final ProviderHealth h : tracker.snapshotAll(store.listProviders())) {
                rows.add(toJson(h));
            }
            respond(exchange, 200, mapper.writeValueAsString(rows));
            return;
        }

        if (path.endsWith(RESET_SUFFIX) && "POST".equals(method)
                && path.length() > PROVIDERS_PATH.length() + 1 + RESET_SUFFIX.length()) {
            final String id = path.substring(PROVIDERS_PATH.length() + 1, path.length() - RESET_SUFFIX.length());
            if (id.isEmpty() || store.getProvider(id).isEmpty()) {
                respond(exchange, 404, "{\"error\":\"provider not found\"}");
                return;
            }
            tracker.resetHealth(id);
            respond(exchange, 200, "{\"status\":\"RESET\"}");
            return;
        }

        respond(exchange, 404, "{\"error\":\"not found\"}");
    }

    private ObjectNode toJson(final ProviderHealth h) {
        final ObjectNode row = mapper.createObjectNode();
        row.put("providerId",          h.getProviderId());
        row.put("providerName",        h.getProviderName());
        row.put("active",              h.isActive());
        row.put("canSend",             h.canSend());
        row.put("healthy",             h.isHealthy());
        row.put("hourlyCount",         h.getHourlyCount());
        row.put("maxPerHour",          h.getMaxPerHour());
        row.put("dailyCount",          h.getDailyCount());
        row.put("maxPerDay",           h.getMaxPerDay());
        row.put("consecutiveFailures", h.getConsecutiveFailures());
        row.put("totalSent",           h.getTotalSent());
        row.put("totalFailed",         h.getTotalFailed());
        row.put("lastUsedAt",          isoOrNull(h.getLastUsedAt()));
        row.put("lastErrorAt",         isoOrNull(h.getLastErrorAt()));
        row.put("lastErrorMessage",    h.getLastErrorMessage());
        return row;
    }

    private static String isoOrNull(final Instant t) {
        return t != null ? t.toString() : null;
    }

    private void respond(final HttpExchange exchange,
                         final int statusCode,
                         final String body) throws IOException {
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
