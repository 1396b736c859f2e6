package com.voltsentinel.flink;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes liveness and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code 200} with {@code {"status":"UP"}} while the
 * server runs</li>
 * <li>{@code GET /readiness}: {@code 503} with {@code {"status":"STARTING"}}
 * until {@link #markReady()} is called, then {@code 200}</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final byte[] UP_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] STARTING_RESPONSE = "{\"status\":\"STARTING\"}".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean ready = new AtomicBoolean(false);

    /**
     * Start the server on the given port. Port {@code 0} binds an ephemeral port.
     *
     * @param port TCP port to bind to; must be in range [0, 65535]
     * @throws IllegalArgumentException if port is out of range
     * @throws UncheckedIOException     if the port cannot be bound
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start health server on port " + port, e);
        }
        server.createContext("/health", this::handleHealth);
        server.createContext("/readiness", this::handleReadiness);

        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "health-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("Health server started on port {}", getPort());
    }

    /**
     * Flip {@code /readiness} to {@code 200}; called once the pipeline is assembled.
     */
    public void markReady() {
        if (ready.compareAndSet(false, true)) {
            LOG.info("Health server reports ready");
        }
    }

    /**
     * Stop the server.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            ready.set(false);
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isReady() {
        return ready.get();
    }

    /**
     * @return the bound port, or {@code -1} if the server is not running
     */
    public int getPort() {
        return server != null && running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        respond(exchange, 200, UP_RESPONSE);
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (ready.get()) {
            respond(exchange, 200, UP_RESPONSE);
        } else {
            respond(exchange, 503, STARTING_RESPONSE);
        }
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
