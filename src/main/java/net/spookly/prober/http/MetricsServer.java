package net.spookly.prober.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import net.spookly.prober.probe.ProbeInfo;
import net.spookly.prober.probe.ProbeResult;
import net.spookly.prober.probe.Prober;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP listener exposing probe metrics in the Prometheus text format and probe status as JSON.
 */
public final class MetricsServer {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final Prober prober;
    private final PrometheusMeterRegistry registry;
    private final HttpServer server;
    private final ExecutorService executor;

    public MetricsServer(InetSocketAddress address, Prober prober, PrometheusMeterRegistry registry) {
        this.prober = Objects.requireNonNull(prober, "prober");
        this.registry = Objects.requireNonNull(registry, "registry");
        try {
            this.server = HttpServer.create(Objects.requireNonNull(address, "address"), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to bind metrics listener on " + address, e);
        }
        this.executor = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "prober-metrics-http");
            thread.setDaemon(true);
            return thread;
        });
        this.server.setExecutor(executor);
        this.server.createContext("/metrics", new MetricsHandler());
        this.server.createContext("/probes", new ProbesHandler());
    }

    public void start() {
        server.start();
        System.out.println("Metrics listening on " + server.getAddress().getHostString() + ":" + server.getAddress().getPort());
    }

    public void stop() {
        server.stop(0);
        executor.shutdownNow();
    }

    /**
     * Bound address; useful when listening on an ephemeral port.
     */
    public InetSocketAddress address() {
        return server.getAddress();
    }

    private abstract static class GetHandler implements HttpHandler {
        @Override
        public final void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", "GET");
                    write(exchange, 405, "text/plain; charset=utf-8", "method not allowed\n");
                    return;
                }
                handleGet(exchange);
            } catch (Exception e) {
                System.err.println("Failed to serve " + exchange.getRequestURI() + ": " + e.getMessage());
                write(exchange, 500, "text/plain; charset=utf-8", "internal error\n");
            } finally {
                exchange.close();
            }
        }

        protected abstract void handleGet(HttpExchange exchange) throws IOException;

        protected void write(HttpExchange exchange, int status, String contentType, String body) throws IOException {
            byte[] payload = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", contentType);
            exchange.sendResponseHeaders(status, payload.length);
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(payload);
            }
        }
    }

    private final class MetricsHandler extends GetHandler {
        @Override
        protected void handleGet(HttpExchange exchange) throws IOException {
            write(exchange, 200, PROMETHEUS_CONTENT_TYPE, registry.scrape());
        }
    }

    private final class ProbesHandler extends GetHandler {
        @Override
        protected void handleGet(HttpExchange exchange) throws IOException {
            write(exchange, 200, JSON_CONTENT_TYPE, statusJson(prober.probeInfo()));
        }
    }

    static String statusJson(Map<String, ProbeInfo> probes) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        for (ProbeInfo info : probes.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("class", info.className());
            entry.put("labels", info.labels());
            entry.put("intervalSecs", info.interval().toMillis() / 1000d);
            info.lastResult().ifPresent(result -> putResult(entry, result));
            body.put(info.name(), entry);
        }
        return MAPPER.writeValueAsString(body);
    }

    private static void putResult(Map<String, Object> entry, ProbeResult result) {
        entry.put("start", result.start().toString());
        entry.put("end", result.end().toString());
        entry.put("latencyMillis", result.latency().toMillis());
        entry.put("result", result.success());
        if (result.failure() != null) {
            entry.put("error", result.failure());
        }
    }
}
