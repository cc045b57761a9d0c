package io.folioledger.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.folioledger.core.directory.NodeRole;
import io.folioledger.core.node.NodeConfig;
import io.folioledger.core.node.NodeRuntime;
import io.folioledger.core.protocol.Transaction;
import io.folioledger.core.protocol.TransactionKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerTest {

    private static final String TOKEN = "api-secret";

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();

    private NodeRuntime node;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        port = freePort();
        NodeConfig config = NodeConfig.builder()
                .role(NodeRole.AUTHORITY)
                .listenPort(freePort())
                .dataDir(tempDir)
                .batchIntervalMillis(60_000L)
                .api(true, "127.0.0.1", port, TOKEN)
                .build();
        node = NodeRuntime.open(config);
        node.start();
    }

    @AfterEach
    void tearDown() {
        if (node != null) {
            node.close();
        }
    }

    @Test
    void requestsWithoutTokenAreRejected() throws Exception {
        HttpResponse<String> unauthorized = http.send(HttpRequest.newBuilder(uri("/chain")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertEquals(401, unauthorized.statusCode());
        assertTrue(unauthorized.headers().firstValue("WWW-Authenticate").isPresent());

        HttpResponse<String> wrongKey = http.send(HttpRequest.newBuilder(uri("/chain"))
                .header("X-API-Key", "nope").GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(401, wrongKey.statusCode());

        HttpResponse<String> apiKey = http.send(HttpRequest.newBuilder(uri("/chain"))
                .header("X-API-Key", TOKEN).GET().build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(200, apiKey.statusCode());
    }

    @Test
    void submittedTransactionMovesFromPendingToIncluded() throws Exception {
        String body = mapper.createObjectNode()
                .put("id", "doc-42")
                .put("kind", "RECORD_ISSUANCE")
                .put("payload", "{\"record\":\"transcript\"}")
                .toString();

        HttpResponse<String> accepted = post("/transactions", body);
        assertEquals(202, accepted.statusCode());
        JsonNode ack = mapper.readTree(accepted.body());
        assertEquals("doc-42", ack.path("id").asText());
        assertEquals("PENDING", ack.path("status").asText());

        assertEquals(409, post("/transactions", body).statusCode());
        assertEquals("PENDING", mapper.readTree(get("/transactions/doc-42").body()).path("status").asText());

        node.producer().orElseThrow().tick().orElseThrow();

        JsonNode included = mapper.readTree(get("/transactions/doc-42").body());
        assertEquals("INCLUDED", included.path("status").asText());
        assertEquals(1L, included.path("block").asLong());
        assertEquals("CONFIRMED", included.path("blockStatus").asText());
        assertEquals(409, post("/transactions", body).statusCode());

        JsonNode chain = mapper.readTree(get("/chain").body());
        assertEquals(1L, chain.path("tip").asLong());
        assertEquals(1L, chain.path("confirmedTip").asLong());
        assertEquals(2L, chain.path("height").asLong());
        assertEquals(0, chain.path("poolSize").asInt());
    }

    @Test
    void invalidSubmissionsAreRejected() throws Exception {
        assertEquals(400, post("/transactions", "{ not json").statusCode());
        assertEquals(400, post("/transactions", "{\"payload\":\"x\"}").statusCode());
        assertEquals(400, post("/transactions", "{\"kind\":\"MINTING\",\"payload\":\"x\"}").statusCode());
        assertEquals(400, post("/transactions", "{\"kind\":\"RECORD_ISSUANCE\"}").statusCode());
        assertEquals(0, node.context().pool().size());
    }

    @Test
    void unknownTransactionIsNotFound() throws Exception {
        HttpResponse<String> response = get("/transactions/missing");
        assertEquals(404, response.statusCode());
        assertEquals("unknown_transaction", mapper.readTree(response.body()).path("error").asText());
    }

    @Test
    void blocksAreServedBySequence() throws Exception {
        HttpResponse<String> genesis = get("/blocks/0");
        assertEquals(200, genesis.statusCode());
        JsonNode block = mapper.readTree(genesis.body());
        assertEquals(0L, block.path("sequence").asLong());
        assertEquals("CONFIRMED", block.path("status").asText());
        assertEquals(node.context().ledger().get(0).contentHash(), block.path("contentHash").asText());

        assertEquals(404, get("/blocks/7").statusCode());
        assertEquals(400, get("/blocks/latest").statusCode());
    }

    @Test
    void nodeInfoMetricsAndOpenApiAreServed() throws Exception {
        JsonNode info = mapper.readTree(get("/node/info").body());
        assertEquals("AUTHORITY", info.path("role").asText());
        assertEquals(node.context().selfIdOrEmpty(), info.path("nodeId").asText());
        assertEquals(1, info.path("directory").path("nodes").asInt());

        get("/chain");
        String chainSeries = "http.server.requests{method=GET,path=/chain,status=200,stat=COUNT}";
        HttpResponse<String> metrics = get("/metrics");
        for (int i = 0; i < 50 && !metrics.body().contains(chainSeries); i++) {
            Thread.sleep(20L);
            metrics = get("/metrics");
        }
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
        assertTrue(metrics.body().contains(chainSeries), metrics.body());
        assertFalse(metrics.body().contains("http.server.requests{stat="));

        HttpResponse<String> openApi = get("/openapi.json");
        assertEquals(200, openApi.statusCode());
        assertEquals("3.0.3", mapper.readTree(openApi.body()).path("openapi").asText());
    }

    @Test
    void verifyHashComparesAgainstTip() throws Exception {
        node.submit(Transaction.builder()
                .id("doc-1")
                .kind(TransactionKind.RECORD_ISSUANCE)
                .payload("{}")
                .createdAt(System.currentTimeMillis())
                .build());
        node.producer().orElseThrow().tick().orElseThrow();
        String tipHash = node.context().ledger().tip().contentHash();
        String genesisHash = node.context().ledger().get(0).contentHash();

        HttpResponse<String> match = verifyHash(tipHash);
        assertEquals(200, match.statusCode());
        assertEquals(1L, mapper.readTree(match.body()).path("tip").asLong());

        HttpResponse<String> stale = verifyHash(genesisHash);
        assertEquals(406, stale.statusCode());
        assertEquals("hash_mismatch", mapper.readTree(stale.body()).path("error").asText());

        assertEquals(400, post("/chain/verify-hash", "").statusCode());
        assertEquals(405, get("/chain/verify-hash").statusCode());
    }

    @Test
    void wrongMethodIsRefused() throws Exception {
        HttpResponse<String> response = http.send(HttpRequest.newBuilder(uri("/chain"))
                .header("Authorization", "Bearer " + TOKEN)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build(), HttpResponse.BodyHandlers.ofString());
        assertEquals(405, response.statusCode());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Authorization", "Bearer " + TOKEN)
                .GET()
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Authorization", "Bearer " + TOKEN)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> verifyHash(String hash) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri("/chain/verify-hash"))
                .header("Authorization", "Bearer " + TOKEN)
                .header("X-Hash", hash)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + port + path);
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
