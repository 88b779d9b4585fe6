package com.example.textembedding.embedding;

import com.example.textembedding.error.OperationTimeoutException;
import com.example.textembedding.error.ProviderFailureException;
import com.example.textembedding.error.RateLimitedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Cohere embed API client ({@code POST /embed}).
 */
public class CohereEmbeddingClient implements EmbeddingProvider {

    public static final String DEFAULT_BASE_URL = "https://api.cohere.ai/v1";
    public static final String DEFAULT_MODEL = "embed-english-v3.0"; // 1024-dim embeddings

    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public CohereEmbeddingClient(String baseUrl, String apiKey, String model, Duration timeout) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String modelId() {
        return model;
    }

    @Override
    public List<List<Double>> embed(List<String> texts, EmbeddingPurpose purpose) {
        // Build request JSON: { "model": "...", "texts": [...], "input_type": "search_document" }
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        ArrayNode textsNode = root.putArray("texts");
        texts.forEach(textsNode::add);
        root.put("input_type", purpose.getInputType());
        root.put("truncate", "NONE");

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/embed"))
                    .timeout(timeout)
                    .header("Authorization", "Bearer " + apiKey)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(root)))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new OperationTimeoutException("Cohere embed call timed out after " + timeout, e);
        } catch (IOException e) {
            throw new ProviderFailureException("Cohere embed call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFailureException("Cohere embed call interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429) {
            throw new RateLimitedException("Cohere embed API rate limit: " + response.body(), status);
        }
        if (status >= 400) {
            throw new ProviderFailureException("Cohere embed API error: " + status
                    + " body: " + response.body(), status);
        }

        return parseEmbeddings(response.body());
    }

    private List<List<Double>> parseEmbeddings(String body) {
        JsonNode embeddingsNode;
        try {
            JsonNode rootNode = objectMapper.readTree(body);
            embeddingsNode = rootNode.path("embeddings");
            // embedding_types responses nest the vectors under "float"
            if (embeddingsNode.isObject()) {
                embeddingsNode = embeddingsNode.path("float");
            }
        } catch (JsonProcessingException e) {
            throw new ProviderFailureException("Cohere embed API returned malformed JSON", e);
        }
        if (!embeddingsNode.isArray()) {
            throw new ProviderFailureException("Cohere embed API response has no embeddings", 200);
        }

        List<List<Double>> vectors = new ArrayList<>(embeddingsNode.size());
        for (JsonNode embeddingArray : embeddingsNode) {
            List<Double> vector = new ArrayList<>(embeddingArray.size());
            for (JsonNode v : embeddingArray) {
                vector.add(v.asDouble());
            }
            vectors.add(vector);
        }
        return vectors;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
