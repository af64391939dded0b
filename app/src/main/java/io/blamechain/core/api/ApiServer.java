package io.blamechain.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.blamechain.core.buffer.EntryRejectedException;
import io.blamechain.core.consensus.ChainVerification;
import io.blamechain.core.consensus.MiningTimeoutException;
import io.blamechain.core.consensus.Violation;
import io.blamechain.core.metrics.HttpMetrics;
import io.blamechain.core.node.Node;
import io.blamechain.core.protocol.Block;
import io.blamechain.core.protocol.BlockCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "Blamechain REST API",
    "version": "1.0.0"
  },
  "paths": {
    "/actions": {
      "post": {
        "summary": "Enqueue one entry into the action buffer",
        "requestBody": {
          "required": true,
          "content": { "application/json": { "schema": {} } }
        },
        "responses": {
          "202": { "description": "Entry buffered; a block is included when the entry completed a batch" },
          "400": { "description": "Invalid JSON or entry too large; nothing was buffered" },
          "503": { "description": "Entry buffered but its block could not be sealed (mining_timeout or seal_failed); do not resend" }
        }
      }
    },
    "/chain": {
      "get": {
        "summary": "All blocks from genesis to head",
        "responses": {
          "200": {
            "description": "Chain snapshot",
            "content": {
              "application/json": {
                "schema": { "type": "array", "items": { "$ref": "#/components/schemas/Block" } }
              }
            }
          }
        }
      }
    },
    "/chain/head": {
      "get": {
        "summary": "Most recently appended block",
        "responses": { "200": { "description": "Head block" } }
      }
    },
    "/chain/verify": {
      "get": {
        "summary": "Recompute every hash and link",
        "responses": { "200": { "description": "Verification report" } }
      }
    },
    "/buffer": {
      "get": {
        "summary": "Entries waiting for the next block",
        "responses": { "200": { "description": "Pending entries and flush threshold" } }
      }
    },
    "/buffer/flush": {
      "post": {
        "summary": "Seal pending entries into a block now",
        "responses": {
          "200": { "description": "Last block mined" },
          "204": { "description": "Nothing pending" },
          "503": { "description": "Sealing failed; entries stay pending" }
        }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Metrics scrape",
        "responses": { "200": { "description": "Plain-text metrics" } }
      }
    },
    "/openapi.json": {
      "get": {
        "summary": "Return this OpenAPI document",
        "responses": { "200": { "description": "OpenAPI specification" } }
      }
    }
  },
  "components": {
    "schemas": {
      "Block": {
        "type": "object",
        "required": ["index", "timestamp", "payload", "previousHash", "nonce", "hash"],
        "properties": {
          "index": { "type": "integer", "format": "int64" },
          "timestamp": { "type": "integer", "format": "int64" },
          "payload": { "type": "array", "items": {} },
          "previousHash": { "type": "string" },
          "nonce": { "type": "integer", "format": "int64" },
          "hash": { "type": "string" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final Node node;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer httpServer;
    private ExecutorService executor;

    public ApiServer(Node node, String bindAddress, int port, String authToken) {
        this.node = node;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper();
    }

    public void start() throws IOException {
        if (httpServer != null) {
            throw new IllegalStateException("API server already running");
        }
        httpServer = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        httpServer.createContext("/actions", new ActionsHandler());
        httpServer.createContext("/chain", new ChainHandler());
        httpServer.createContext("/chain/head", new HeadHandler());
        httpServer.createContext("/chain/verify", new VerifyHandler());
        httpServer.createContext("/buffer", new BufferHandler());
        httpServer.createContext("/buffer/flush", new FlushHandler());
        httpServer.createContext("/metrics", new MetricsHandler(this::ensureAuthorized));
        httpServer.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "blamechain-api");
            t.setDaemon(true);
            return t;
        });
        httpServer.setExecutor(executor);
        httpServer.start();
        LOG.info(() -> "API server listening on http://" + bindAddress + ':' + port + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
            httpServer = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /** Returns -1 when the request may proceed, otherwise the status already sent. */
    int ensureAuthorized(HttpExchange exchange) throws IOException {
        if (authToken == null) {
            return -1;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return -1;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        if (apiKey != null && apiKey.equals(authToken)) {
            return -1;
        }
        exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
        return sendError(exchange, 401, "unauthorized", "Missing or invalid credentials");
    }

    /** Shared plumbing: metrics, exact path match, method check, auth, 500 on unexpected errors. */
    abstract class Endpoint implements HttpHandler {
        private final String allowedMethod;

        Endpoint(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!path.equals(exchange.getRequestURI().getPath())) {
                    status = sendError(exchange, 404, "not_found", "No such resource: " + exchange.getRequestURI().getPath());
                    return;
                }
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    exchange.getResponseHeaders().set("Allow", allowedMethod);
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = serve(exchange);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Request " + method + " " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }

        abstract int serve(HttpExchange exchange) throws IOException;
    }

    class ActionsHandler extends Endpoint {
        ActionsHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            JsonNode entry;
            try (InputStream body = exchange.getRequestBody()) {
                entry = mapper.readTree(body);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Request body must be a JSON value");
            }
            if (entry == null || entry.isMissingNode()) {
                return sendError(exchange, 400, "missing_entry", "Request body is empty");
            }

            Optional<Block> mined;
            try {
                mined = node.buffer().enqueue(entry);
            } catch (EntryRejectedException e) {
                return sendError(exchange, 400, "invalid_entry", Optional.ofNullable(e.getMessage()).orElse("Rejected entry"));
            } catch (RuntimeException e) {
                // the entry is already pending; a retry would buffer it twice
                return sendSealFailure(exchange, e);
            }

            ObjectNode resp = mapper.createObjectNode();
            resp.put("status", "accepted");
            resp.put("pending", node.buffer().size());
            mined.ifPresent(block -> {
                resp.put("minedBlock", block.index());
                resp.put("hash", block.hash());
            });
            return sendJson(exchange, 202, resp);
        }
    }

    class ChainHandler extends Endpoint {
        ChainHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, BlockCodec.toJson(node.chain().blocks()));
        }
    }

    class HeadHandler extends Endpoint {
        HeadHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, BlockCodec.toJson(node.chain().head()));
        }
    }

    class VerifyHandler extends Endpoint {
        VerifyHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            ChainVerification result = node.chain().verify();
            if (!result.isValid()) {
                LOG.warning(() -> "Chain verification failed: " + result);
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("valid", result.isValid());
            resp.put("length", result.length());
            resp.put("difficulty", node.chain().difficulty());
            ArrayNode violations = resp.putArray("violations");
            for (Violation v : result.violations()) {
                violations.addObject()
                        .put("index", v.index())
                        .put("reason", v.type().name())
                        .put("message", v.message());
            }
            return sendJson(exchange, 200, resp);
        }
    }

    class BufferHandler extends Endpoint {
        BufferHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            ObjectNode resp = mapper.createObjectNode();
            resp.put("threshold", node.buffer().flushThreshold());
            ArrayNode pending = resp.putArray("pending");
            node.buffer().pending().forEach(pending::add);
            return sendJson(exchange, 200, resp);
        }
    }

    class FlushHandler extends Endpoint {
        FlushHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            Optional<Block> mined;
            try {
                mined = node.buffer().flush();
            } catch (RuntimeException e) {
                return sendSealFailure(exchange, e);
            }
            if (mined.isEmpty()) {
                exchange.sendResponseHeaders(204, -1);
                return 204;
            }
            return sendJson(exchange, 200, BlockCodec.toJson(mined.get()));
        }
    }

    class OpenApiHandler extends Endpoint {
        OpenApiHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    /** 503 for a batch that could not be sealed; its entries stay pending. */
    private int sendSealFailure(HttpExchange exchange, RuntimeException e) throws IOException {
        ObjectNode resp = mapper.createObjectNode();
        if (e instanceof MiningTimeoutException) {
            LOG.warning(e.getMessage());
            resp.put("error", "mining_timeout");
        } else {
            LOG.log(Level.WARNING, "Sealing pending entries failed", e);
            resp.put("error", "seal_failed");
        }
        resp.put("message", Optional.ofNullable(e.getMessage()).orElse(e.getClass().getSimpleName()));
        resp.put("pending", node.buffer().size());
        return sendJson(exchange, 503, resp);
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else {
            payload = mapper.writeValueAsBytes(body);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("error", code);
        node.put("message", message);
        return sendJson(exchange, status, node);
    }
}
