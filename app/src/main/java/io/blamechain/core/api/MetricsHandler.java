package io.blamechain.core.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.blamechain.core.metrics.BlockMetrics;
import io.blamechain.core.metrics.HttpMetrics;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Plain-text scrape of the Micrometer registry. */
public final class MetricsHandler implements HttpHandler {
    private static final Logger LOG = Logger.getLogger(MetricsHandler.class.getName());

    /** Returns -1 to let the request through, otherwise the status already sent. */
    @FunctionalInterface
    interface Authorizer {
        int check(HttpExchange exchange) throws IOException;
    }

    private final Authorizer authorizer;

    MetricsHandler(Authorizer authorizer) {
        this.authorizer = authorizer;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getHttpContext().getPath();
        var sample = HttpMetrics.start();
        int status = 500;
        try {
            if (!"GET".equalsIgnoreCase(method)) {
                status = sendPlain(exchange, 405, "Method Not Allowed");
                return;
            }
            status = authorizer.check(exchange);
            if (status != -1) {
                return;
            }
            status = sendPlain(exchange, 200, BlockMetrics.scrapeMetrics());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Metrics scrape failed", e);
            status = sendPlain(exchange, 500, "Internal Server Error");
        } finally {
            HttpMetrics.stop(sample, method, path, status);
            exchange.close();
        }
    }

    private int sendPlain(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
        return status;
    }
}
