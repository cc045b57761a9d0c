package io.folioledger.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.folioledger.core.mempool.DuplicateTransactionException;
import io.folioledger.core.mempool.EvictedException;
import io.folioledger.core.mempool.SubmissionStatus;
import io.folioledger.core.metrics.LedgerMetrics;
import io.folioledger.core.node.NodeRuntime;
import io.folioledger.core.protocol.Block;
import io.folioledger.core.protocol.BlockCodec;
import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.protocol.TransactionKind;
import io.folioledger.core.storage.LedgerStore;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * REST surface of a node: transaction submission and lookup, chain and block queries, node info,
 * metrics. With a token configured every request needs {@code Authorization: Bearer <token>} or
 * {@code X-API-Key: <token>}.
 */
public class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());
    private static final byte[] OPENAPI_SPEC = """
{
  "openapi": "3.0.3",
  "info": {
    "title": "folio-ledger node API",
    "version": "1.0.0"
  },
  "paths": {
    "/transactions": {
      "post": {
        "summary": "Submit a transaction to the node's pool",
        "requestBody": {
          "required": true,
          "content": {
            "application/json": {
              "schema": { "$ref": "#/components/schemas/SubmitTransaction" }
            }
          }
        },
        "responses": {
          "202": { "description": "Transaction pooled" },
          "400": { "description": "Invalid transaction" },
          "409": { "description": "Transaction id already pending or included" }
        }
      }
    },
    "/transactions/{id}": {
      "get": {
        "summary": "Status of a submitted transaction",
        "parameters": [
          { "name": "id", "in": "path", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "PENDING, INCLUDED (with block and block status) or EVICTED" },
          "404": { "description": "Unknown transaction" }
        }
      }
    },
    "/chain": {
      "get": {
        "summary": "Tip, confirmed tip, height and pool size",
        "responses": { "200": { "description": "Chain information" } }
      }
    },
    "/chain/verify-hash": {
      "post": {
        "summary": "Check a chain hash against this node's tip",
        "parameters": [
          { "name": "X-Hash", "in": "header", "required": true, "schema": { "type": "string" } }
        ],
        "responses": {
          "200": { "description": "Hash equals the tip content hash" },
          "400": { "description": "X-Hash header missing" },
          "406": { "description": "Hash does not match the tip" }
        }
      }
    },
    "/blocks/{sequence}": {
      "get": {
        "summary": "One block with its status",
        "parameters": [
          { "name": "sequence", "in": "path", "required": true, "schema": { "type": "integer", "format": "int64" } }
        ],
        "responses": {
          "200": { "description": "Block" },
          "404": { "description": "No block at this sequence" }
        }
      }
    },
    "/node/info": {
      "get": {
        "summary": "Node properties and directory statistics",
        "responses": { "200": { "description": "Node information" } }
      }
    },
    "/metrics": {
      "get": {
        "summary": "Counters and timers as text",
        "responses": { "200": { "description": "Metrics" } }
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
      "SubmitTransaction": {
        "type": "object",
        "required": ["kind", "payload"],
        "properties": {
          "id": { "type": "string", "description": "Optional; derived from the content when absent" },
          "kind": { "type": "string", "enum": ["RECORD_ISSUANCE", "NODE_REGISTRATION", "ACCOUNT_REGISTRATION", "DOCUMENT_REQUEST", "REQUEST_CLOSED"] },
          "payload": { "type": "string" },
          "submitter": { "type": "string" }
        }
      }
    }
  }
}
""".getBytes(StandardCharsets.UTF_8);

    private final NodeRuntime runtime;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper;
    private HttpServer httpServer;
    private ExecutorService executor;

    public ApiServer(NodeRuntime runtime, String bindAddress, int port, String authToken) {
        this.runtime = runtime;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        if (httpServer != null) {
            throw new IllegalStateException("API server already running");
        }
        httpServer = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        httpServer.createContext("/transactions", new TransactionsHandler());
        httpServer.createContext("/chain", new ChainInfoHandler());
        httpServer.createContext("/chain/verify-hash", new VerifyHashHandler());
        httpServer.createContext("/blocks", new BlocksHandler());
        httpServer.createContext("/node/info", new NodeInfoHandler());
        httpServer.createContext("/metrics", new MetricsHandler());
        httpServer.createContext("/openapi.json", new OpenApiHandler());
        executor = Executors.newCachedThreadPool();
        httpServer.setExecutor(executor);
        httpServer.start();
        LOG.info(() -> "API HTTP server listening on http://" + bindAddress + ':' + boundPort()
                + (authToken != null ? " (auth required)" : ""));
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

    public int boundPort() {
        return httpServer == null ? -1 : httpServer.getAddress().getPort();
    }

    /**
     * Shared request plumbing: timing, auth and error mapping. Subclasses return the status they sent.
     */
    abstract class ApiHandler implements HttpHandler {
        private final String allowedMethod;

        ApiHandler(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = LedgerMetrics.startHttp();
            int status = 500;
            try {
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = ensureAuthorized(exchange);
                if (status != -1) {
                    return;
                }
                status = serve(exchange);
            } catch (Exception e) {
                LOG.log(Level.WARNING, method + ' ' + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                LedgerMetrics.stopHttp(sample, method, path, status);
                exchange.close();
            }
        }

        abstract int serve(HttpExchange exchange) throws IOException;
    }

    class TransactionsHandler implements HttpHandler {
        private final ApiHandler submit = new ApiHandler("POST") {
            @Override
            int serve(HttpExchange exchange) throws IOException {
                return submitTransaction(exchange);
            }
        };
        private final ApiHandler lookup = new ApiHandler("GET") {
            @Override
            int serve(HttpExchange exchange) throws IOException {
                return transactionStatus(exchange);
            }
        };

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (pathRemainder(exchange).isEmpty()) {
                submit.handle(exchange);
            } else {
                lookup.handle(exchange);
            }
        }
    }

    private int submitTransaction(HttpExchange exchange) throws IOException {
        if (!pathRemainder(exchange).isEmpty()) {
            return sendError(exchange, 404, "not_found", "Unknown path");
        }
        SubmitTransactionRequest req;
        try {
            req = mapper.readValue(exchange.getRequestBody(), SubmitTransactionRequest.class);
        } catch (JsonProcessingException e) {
            return sendError(exchange, 400, "invalid_json", "Failed to parse transaction request");
        }
        if (req == null || req.kind == null || req.kind.isBlank()) {
            return sendError(exchange, 400, "missing_kind", "Field 'kind' is required");
        }
        Transaction tx;
        try {
            tx = Transaction.builder()
                    .id(req.id)
                    .kind(TransactionKind.parse(req.kind))
                    .payload(req.payload)
                    .submitterId(req.submitter)
                    .createdAt(System.currentTimeMillis())
                    .build();
            runtime.submit(tx);
        } catch (DuplicateTransactionException e) {
            return sendError(exchange, 409, "duplicate_transaction", e.getMessage());
        } catch (IllegalArgumentException e) {
            return sendError(exchange, 400, "invalid_transaction", Optional.ofNullable(e.getMessage()).orElse("Rejected transaction"));
        }
        ObjectNode resp = mapper.createObjectNode()
                .put("id", tx.id())
                .put("status", SubmissionStatus.PENDING.name());
        return sendJson(exchange, 202, resp);
    }

    private int transactionStatus(HttpExchange exchange) throws IOException {
        String id = URLDecoder.decode(pathRemainder(exchange), StandardCharsets.UTF_8);
        SubmissionStatus status = runtime.context().pool().status(id);
        ObjectNode resp = mapper.createObjectNode().put("id", id).put("status", status.name());
        switch (status) {
            case INCLUDED:
                LedgerStore ledger = runtime.context().ledger();
                Optional<Long> sequence = ledger.blockOf(id);
                if (sequence.isPresent()) {
                    resp.put("block", sequence.get());
                    ledger.find(sequence.get()).ifPresent(b -> resp.put("blockStatus", b.status().name()));
                }
                return sendJson(exchange, 200, resp);
            case EVICTED:
                runtime.context().pool().evictionOf(id).map(EvictedException::reason).ifPresent(r -> resp.put("reason", r));
                return sendJson(exchange, 200, resp);
            case PENDING:
                return sendJson(exchange, 200, resp);
            default:
                return sendError(exchange, 404, "unknown_transaction", "No transaction with id " + id);
        }
    }

    class ChainInfoHandler extends ApiHandler {
        ChainInfoHandler() {
            super("GET");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            LedgerStore ledger = runtime.context().ledger();
            Block tip = ledger.tip();
            Block confirmed = ledger.confirmedTip();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("tip", tip.sequence());
            resp.put("tipHash", tip.contentHash());
            resp.put("tipStatus", tip.status().name());
            resp.put("confirmedTip", confirmed.sequence());
            resp.put("confirmedTipHash", confirmed.contentHash());
            resp.put("height", ledger.size());
            resp.put("poolSize", runtime.context().pool().size());
            return sendJson(exchange, 200, resp);
        }
    }

    /** A peer or client holding the tip hash can check it is on the same chain. */
    class VerifyHashHandler extends ApiHandler {
        VerifyHashHandler() {
            super("POST");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String given = exchange.getRequestHeaders().getFirst("X-Hash");
            if (given == null || given.isBlank()) {
                return sendError(exchange, 400, "missing_hash", "Header 'X-Hash' is required");
            }
            Block tip = runtime.context().ledger().tip();
            if (!tip.contentHash().equalsIgnoreCase(given.trim())) {
                return sendError(exchange, 406, "hash_mismatch", "Hash does not match the chain tip");
            }
            ObjectNode resp = mapper.createObjectNode()
                    .put("tip", tip.sequence())
                    .put("tipHash", tip.contentHash());
            return sendJson(exchange, 200, resp);
        }
    }

    class BlocksHandler extends ApiHandler {
        BlocksHandler() {
            super("GET");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            String raw = pathRemainder(exchange);
            long sequence;
            try {
                sequence = Long.parseLong(raw);
            } catch (NumberFormatException e) {
                return sendError(exchange, 400, "invalid_sequence", "Block sequence must be a number: " + raw);
            }
            Optional<Block> block = runtime.context().ledger().find(sequence);
            if (block.isEmpty()) {
                return sendError(exchange, 404, "block_not_found", "No block at sequence " + sequence);
            }
            return sendJson(exchange, 200, BlockCodec.toJson(block.get()));
        }
    }

    class NodeInfoHandler extends ApiHandler {
        NodeInfoHandler() {
            super("GET");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, runtime.info());
        }
    }

    class MetricsHandler extends ApiHandler {
        MetricsHandler() {
            super("GET");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            byte[] out = LedgerMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            exchange.sendResponseHeaders(200, out.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(out);
            }
            return 200;
        }
    }

    class OpenApiHandler extends ApiHandler {
        OpenApiHandler() {
            super("GET");
        }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, OPENAPI_SPEC);
        }
    }

    public static class SubmitTransactionRequest {
        public String id;
        public String kind;
        public String payload;
        public String submitter;
    }

    private int ensureAuthorized(HttpExchange exchange) throws IOException {
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

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload;
        if (body instanceof byte[] bytes) {
            payload = bytes;
        } else if (body instanceof String str) {
            payload = str.getBytes(StandardCharsets.UTF_8);
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

    /** Path below the handler's context, without leading slashes. */
    private static String pathRemainder(HttpExchange exchange) {
        String context = exchange.getHttpContext().getPath();
        String path = exchange.getRequestURI().getRawPath();
        String rest = path.length() > context.length() ? path.substring(context.length()) : "";
        while (rest.startsWith("/")) {
            rest = rest.substring(1);
        }
        return rest;
    }
}
