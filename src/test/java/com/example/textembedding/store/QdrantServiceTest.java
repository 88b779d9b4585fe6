package com.example.textembedding.store;

import com.example.textembedding.error.OperationTimeoutException;
import com.example.textembedding.error.StorageReadException;
import com.example.textembedding.error.StorageWriteException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QdrantServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /** "METHOD /path" -> status and body */
    private final Map<String, Object[]> routes = new ConcurrentHashMap<>();
    private final Map<String, String> requestBodies = new ConcurrentHashMap<>();
    private final Map<String, String> apiKeys = new ConcurrentHashMap<>();
    private final Map<String, String> queries = new ConcurrentHashMap<>();

    private HttpServer server;
    private QdrantService qdrantService;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(Executors.newCachedThreadPool());
        server.createContext("/", exchange -> {
            String key = exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath();
            requestBodies.put(key, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String apiKey = exchange.getRequestHeaders().getFirst("api-key");
            if (apiKey != null) {
                apiKeys.put(key, apiKey);
            }
            String query = exchange.getRequestURI().getQuery();
            if (query != null) {
                queries.put(key, query);
            }
            Object[] route = routes.getOrDefault(key,
                    new Object[]{404, "{\"status\":{\"error\":\"Not found\"}}"});
            if (route.length > 2) {
                try {
                    Thread.sleep((Long) route[2]);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            byte[] bytes = ((String) route[1]).getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders((Integer) route[0], bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        qdrantService = new QdrantService("http://127.0.0.1:" + server.getAddress().getPort() + "/",
                "qdrant-key", Duration.ofSeconds(5));
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private void route(String key, int status, String body) {
        routes.put(key, new Object[]{status, body});
    }

    @Test
    void listsCollectionNamesWithApiKey() {
        route("GET /collections", 200,
                "{\"result\":{\"collections\":[{\"name\":\"text_embeddings\"},{\"name\":\"other\"}]},\"status\":\"ok\"}");

        assertThat(qdrantService.listCollections()).containsExactly("text_embeddings", "other");
        assertThat(apiKeys.get("GET /collections")).isEqualTo("qdrant-key");
    }

    @Test
    void createsCollectionWithSizeAndCosineDistance() throws Exception {
        route("PUT /collections/text_embeddings", 200, "{\"result\":true,\"status\":\"ok\"}");

        boolean created = qdrantService.createCollection("text_embeddings", 1024, DistanceMetric.COSINE);

        assertThat(created).isTrue();
        JsonNode sent = objectMapper.readTree(requestBodies.get("PUT /collections/text_embeddings"));
        assertThat(sent.path("vectors").path("size").asInt()).isEqualTo(1024);
        assertThat(sent.path("vectors").path("distance").asText()).isEqualTo("Cosine");
    }

    @Test
    void conflictOnCreateMeansAlreadyExists() {
        route("PUT /collections/text_embeddings", 409,
                "{\"status\":{\"error\":\"Wrong input: Collection `text_embeddings` already exists!\"}}");

        assertThat(qdrantService.createCollection("text_embeddings", 1024, DistanceMetric.COSINE)).isFalse();
    }

    @Test
    void upsertsPointsAndWaitsForWrite() throws Exception {
        route("PUT /collections/text_embeddings/points", 200,
                "{\"result\":{\"operation_id\":1,\"status\":\"completed\"},\"status\":\"ok\"}");
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", "foo");
        payload.put("category", "AI");

        qdrantService.upsert("text_embeddings", List.of(
                new EmbeddingRecord("5c56c793-69f3-4fbf-87e6-c4bf54c28c26", List.of(0.5, 0.25), payload)));

        JsonNode sent = objectMapper.readTree(requestBodies.get("PUT /collections/text_embeddings/points"));
        JsonNode point = sent.path("points").get(0);
        assertThat(point.path("id").asText()).isEqualTo("5c56c793-69f3-4fbf-87e6-c4bf54c28c26");
        assertThat(point.path("vector").get(1).asDouble()).isEqualTo(0.25);
        assertThat(point.path("payload").path("category").asText()).isEqualTo("AI");
        assertThat(queries.get("PUT /collections/text_embeddings/points")).isEqualTo("wait=true");
    }

    @Test
    void searchSendsLimitAndFilterAndMapsHits() throws Exception {
        route("POST /collections/text_embeddings/points/search", 200, """
                {"result":[
                  {"id":"a1","version":0,"score":0.93,"payload":{"text":"A cat sleeps","category":"animals"}},
                  {"id":42,"version":0,"score":0.41,"payload":null}
                ],"status":"ok"}
                """);

        List<SearchHit> hits = qdrantService.search("text_embeddings", List.of(0.1, 0.2), 2,
                Map.of("category", "animals"));

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).getId()).isEqualTo("a1");
        assertThat(hits.get(0).getScore()).isEqualTo(0.93);
        assertThat(hits.get(0).getPayload()).containsEntry("text", "A cat sleeps");
        assertThat(hits.get(1).getId()).isEqualTo("42");
        assertThat(hits.get(1).getPayload()).isEmpty();

        JsonNode sent = objectMapper.readTree(requestBodies.get("POST /collections/text_embeddings/points/search"));
        assertThat(sent.path("limit").asInt()).isEqualTo(2);
        assertThat(sent.path("with_payload").asBoolean()).isTrue();
        JsonNode condition = sent.path("filter").path("must").get(0);
        assertThat(condition.path("key").asText()).isEqualTo("category");
        assertThat(condition.path("match").path("value").asText()).isEqualTo("animals");
    }

    @Test
    void searchWithoutFilterOmitsFilter() throws Exception {
        route("POST /collections/text_embeddings/points/search", 200, "{\"result\":[],\"status\":\"ok\"}");

        assertThat(qdrantService.search("text_embeddings", List.of(0.1), 5, Map.of())).isEmpty();

        JsonNode sent = objectMapper.readTree(requestBodies.get("POST /collections/text_embeddings/points/search"));
        assertThat(sent.has("filter")).isFalse();
    }

    @Test
    void countsPointsExactly() throws Exception {
        route("POST /collections/text_embeddings/points/count", 200, "{\"result\":{\"count\":17},\"status\":\"ok\"}");

        assertThat(qdrantService.count("text_embeddings")).isEqualTo(17L);
        JsonNode sent = objectMapper.readTree(requestBodies.get("POST /collections/text_embeddings/points/count"));
        assertThat(sent.path("exact").asBoolean()).isTrue();
    }

    @Test
    void deletesPointsById() throws Exception {
        route("POST /collections/text_embeddings/points/delete", 200,
                "{\"result\":{\"operation_id\":2,\"status\":\"completed\"},\"status\":\"ok\"}");

        qdrantService.delete("text_embeddings", List.of("a1", "b2"));

        JsonNode sent = objectMapper.readTree(requestBodies.get("POST /collections/text_embeddings/points/delete"));
        assertThat(sent.path("points").size()).isEqualTo(2);
        assertThat(sent.path("points").get(0).asText()).isEqualTo("a1");
    }

    @Test
    void serverErrorOnUpsertIsStorageWriteError() {
        route("PUT /collections/text_embeddings/points", 500, "{\"status\":{\"error\":\"boom\"}}");

        assertThatThrownBy(() -> qdrantService.upsert("text_embeddings",
                List.of(new EmbeddingRecord("id-1", List.of(1.0), Map.of("text", "x")))))
                .isInstanceOf(StorageWriteException.class)
                .hasMessageContaining("500")
                .satisfies(ex -> assertThat(((StorageWriteException) ex).isConnectionFailure()).isFalse())
                .satisfies(ex -> assertThat(((StorageWriteException) ex).isCollectionMissing()).isFalse());
    }

    @Test
    void missingCollectionOnSearchIsStorageReadError() {
        assertThatThrownBy(() -> qdrantService.search("missing", List.of(1.0), 3, Map.of()))
                .isInstanceOf(StorageReadException.class)
                .hasMessageContaining("404")
                .satisfies(ex -> assertThat(((StorageReadException) ex).isCollectionMissing()).isTrue());
    }

    @Test
    void slowStoreSurfacesAsTimeout() {
        routes.put("GET /collections", new Object[]{200, "{\"result\":{\"collections\":[]}}", 1_000L});
        QdrantService impatient = new QdrantService("http://127.0.0.1:" + server.getAddress().getPort(),
                null, Duration.ofMillis(200));

        assertThatThrownBy(impatient::listCollections).isInstanceOf(OperationTimeoutException.class);
    }

    @Test
    void unreachableStoreIsConnectionFailure() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        QdrantService unreachable = new QdrantService("http://127.0.0.1:" + closedPort, "k", Duration.ofSeconds(2));

        assertThatThrownBy(unreachable::listCollections)
                .isInstanceOf(StorageReadException.class)
                .satisfies(ex -> assertThat(((StorageReadException) ex).isConnectionFailure()).isTrue());
    }
}
