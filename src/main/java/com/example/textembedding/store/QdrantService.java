package com.example.textembedding.store;

import com.example.textembedding.error.OperationTimeoutException;
import com.example.textembedding.error.StorageReadException;
import com.example.textembedding.error.StorageWriteException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link VectorStore} backed by the Qdrant REST API.
 */
public class QdrantService implements VectorStore {

    public static final String DEFAULT_HOST = "http://localhost:6333";

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public QdrantService(String baseUrl, String apiKey, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        // payload values may carry java.time types supplied by callers
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public List<String> listCollections() {
        // GET /collections -> { "result": { "collections": [ { "name": "..." } ] } }
        HttpResponse<String> response = send(newRequest("/collections").GET().build(),
                "list collections", false);
        JsonNode collections = readTree(response.body(), false).path("result").path("collections");

        List<String> names = new ArrayList<>();
        for (JsonNode collection : collections) {
            names.add(collection.path("name").asText());
        }
        return names;
    }

    @Override
    public boolean createCollection(String collectionName, int vectorSize, DistanceMetric metric) {
        // PUT /collections/{name}
        // body: { "vectors": { "size": 1024, "distance": "Cosine" } }
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode vectorsNode = root.putObject("vectors");
        vectorsNode.put("size", vectorSize);
        vectorsNode.put("distance", metric.getQdrantName());

        HttpRequest request = newRequest("/collections/" + encode(collectionName))
                .PUT(HttpRequest.BodyPublishers.ofString(writeJson(root, true)))
                .build();

        HttpResponse<String> response = sendRaw(request, "create collection", true);
        // 409: a concurrent caller created it first
        if (response.statusCode() == 409) {
            return false;
        }
        requireSuccess(response, "create collection " + collectionName, true);
        return true;
    }

    @Override
    public void upsert(String collectionName, List<EmbeddingRecord> records) {
        // Build Qdrant "points" array: [{ id, vector, payload }, ...]
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode pointsArray = root.putArray("points");

        for (EmbeddingRecord record : records) {
            ObjectNode pointNode = pointsArray.addObject();
            pointNode.put("id", record.getId());

            ArrayNode vectorNode = pointNode.putArray("vector");
            for (Double v : record.getVector()) {
                vectorNode.add(v);
            }

            // Payload – arbitrary JSON, mapped from our Map<String, Object>
            pointNode.set("payload", objectMapper.valueToTree(record.getPayload()));
        }

        HttpRequest request = newRequest("/collections/" + encode(collectionName) + "/points?wait=true")
                .PUT(HttpRequest.BodyPublishers.ofString(writeJson(root, true)))
                .build();

        send(request, "upsert " + records.size() + " points", true);
    }

    @Override
    public List<SearchHit> search(String collectionName, List<Double> vector, int limit, Map<String, Object> filter) {
        // { "vector": [...], "limit": topK, "with_payload": true, "filter": { "must": [...] } }
        ObjectNode root = objectMapper.createObjectNode();

        ArrayNode vectorNode = root.putArray("vector");
        for (Double v : vector) {
            vectorNode.add(v);
        }
        root.put("limit", limit);
        root.put("with_payload", true);
        root.put("with_vector", false);
        if (filter != null && !filter.isEmpty()) {
            root.set("filter", buildFilter(filter));
        }

        HttpRequest request = newRequest("/collections/" + encode(collectionName) + "/points/search")
                .POST(HttpRequest.BodyPublishers.ofString(writeJson(root, false)))
                .build();

        HttpResponse<String> response = send(request, "search points", false);

        JsonNode resultArray = readTree(response.body(), false).path("result");
        List<SearchHit> results = new ArrayList<>();
        for (JsonNode pointNode : resultArray) {
            String id = pointNode.path("id").asText();
            double score = pointNode.path("score").asDouble();
            JsonNode payloadNode = pointNode.path("payload");
            Map<String, Object> payload = payloadNode.isObject()
                    ? objectMapper.convertValue(payloadNode, PAYLOAD_TYPE)
                    : Map.of();
            results.add(new SearchHit(id, score, payload));
        }
        return results;
    }

    @Override
    public long count(String collectionName) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("exact", true);

        HttpRequest request = newRequest("/collections/" + encode(collectionName) + "/points/count")
                .POST(HttpRequest.BodyPublishers.ofString(writeJson(root, false)))
                .build();

        HttpResponse<String> response = send(request, "count points", false);
        JsonNode countNode = readTree(response.body(), false).path("result").path("count");
        if (!countNode.isNumber()) {
            throw new StorageReadException("Qdrant count response has no count: " + response.body());
        }
        return countNode.asLong();
    }

    @Override
    public void delete(String collectionName, List<String> ids) {
        // { "points": [id, ...] }
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode pointsArray = root.putArray("points");
        ids.forEach(pointsArray::add);

        HttpRequest request = newRequest("/collections/" + encode(collectionName) + "/points/delete?wait=true")
                .POST(HttpRequest.BodyPublishers.ofString(writeJson(root, true)))
                .build();

        send(request, "delete " + ids.size() + " points", true);
    }

    private ObjectNode buildFilter(Map<String, Object> filter) {
        ObjectNode filterNode = objectMapper.createObjectNode();
        ArrayNode must = filterNode.putArray("must");
        filter.forEach((key, value) -> {
            ObjectNode condition = must.addObject();
            condition.put("key", key);
            condition.putObject("match").set("value", objectMapper.valueToTree(value));
        });
        return filterNode;
    }

    private HttpRequest.Builder newRequest(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request, String operation, boolean write) {
        HttpResponse<String> response = sendRaw(request, operation, write);
        requireSuccess(response, operation, write);
        return response;
    }

    private HttpResponse<String> sendRaw(HttpRequest request, String operation, boolean write) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new OperationTimeoutException("Qdrant " + operation + " timed out after " + timeout, e);
        } catch (IOException e) {
            String message = "Qdrant unreachable during " + operation + ": " + e.getMessage();
            throw write ? new StorageWriteException(message, e) : new StorageReadException(message, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String message = "Interrupted during Qdrant " + operation;
            throw write ? new StorageWriteException(message, e) : new StorageReadException(message, e);
        }
    }

    private static void requireSuccess(HttpResponse<String> response, String operation, boolean write) {
        if (response.statusCode() >= 400) {
            String message = "Failed to " + operation + ": " + response.statusCode()
                    + " body: " + response.body();
            // every path addresses /collections/{name}/..., so 404 means the collection is gone
            boolean collectionMissing = response.statusCode() == 404;
            throw write
                    ? new StorageWriteException(message, collectionMissing)
                    : new StorageReadException(message, collectionMissing);
        }
    }

    private String writeJson(JsonNode node, boolean write) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            String message = "Cannot serialize Qdrant request: " + e.getOriginalMessage();
            throw write ? new StorageWriteException(message) : new StorageReadException(message);
        }
    }

    private JsonNode readTree(String body, boolean write) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            String message = "Malformed Qdrant response: " + e.getOriginalMessage();
            throw write ? new StorageWriteException(message) : new StorageReadException(message);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
