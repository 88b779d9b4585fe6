package com.example.textembedding.retrieval;

import com.example.textembedding.collection.CollectionManager;
import com.example.textembedding.embedding.EmbeddingPurpose;
import com.example.textembedding.embedding.EmbeddingService;
import com.example.textembedding.error.InvalidInputException;
import com.example.textembedding.ingest.PayloadMerger;
import com.example.textembedding.store.DistanceMetric;
import com.example.textembedding.store.SearchHit;
import com.example.textembedding.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Answers similarity queries: embed the query, search the collection, map hits.
 * Results keep the store's order (best first). An empty list means the
 * collection had nothing to return; store and provider failures are thrown.
 */
public class RetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);

    private final VectorStore vectorStore;
    private final CollectionManager collectionManager;
    private final EmbeddingService embeddingService;
    private final String collectionName;
    private final int maxTopK;

    public RetrievalService(VectorStore vectorStore,
                            CollectionManager collectionManager,
                            EmbeddingService embeddingService,
                            String collectionName,
                            int maxTopK) {
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.collectionManager = Objects.requireNonNull(collectionManager, "collectionManager");
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        this.maxTopK = maxTopK;
    }

    public List<QueryResult> retrieve(String query, int topK) {
        return retrieve(query, topK, Map.of());
    }

    /**
     * @param filter payload key to exact value, all must match; may be empty
     */
    public List<QueryResult> retrieve(String query, int topK, Map<String, Object> filter) {
        if (query == null || query.isBlank()) {
            throw new InvalidInputException("Query text cannot be empty");
        }
        if (topK < 1 || topK > maxTopK) {
            throw new InvalidInputException("top_k must be between 1 and " + maxTopK);
        }
        validateFilter(filter);

        ensureCollection();
        List<Double> queryVector = embeddingService.embedOne(query, EmbeddingPurpose.QUERY);

        List<SearchHit> hits;
        try {
            hits = vectorStore.search(collectionName, queryVector, topK, filter == null ? Map.of() : filter);
        } catch (RuntimeException e) {
            collectionManager.onFailure(collectionName, e);
            throw e;
        }

        List<QueryResult> results = hits.stream()
                .limit(topK)
                .map(RetrievalService::toQueryResult)
                .toList();
        log.info("Retrieved {} similar embeddings for query", results.size());
        return results;
    }

    /**
     * Exact number of records in the collection.
     */
    public long countRecords() {
        ensureCollection();
        try {
            return vectorStore.count(collectionName);
        } catch (RuntimeException e) {
            collectionManager.onFailure(collectionName, e);
            throw e;
        }
    }

    /**
     * Exact-match conditions only take keywords, integers and booleans.
     */
    private static void validateFilter(Map<String, Object> filter) {
        if (filter == null) {
            return;
        }
        filter.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new InvalidInputException("Filter keys cannot be empty");
            }
            if (!isMatchable(value)) {
                throw new InvalidInputException("Filter value for '" + key
                        + "' must be a string, an integer or a boolean, got " + describe(value));
            }
        });
    }

    private static boolean isMatchable(Object value) {
        return value instanceof String
                || value instanceof Boolean
                || value instanceof Integer
                || value instanceof Long
                || value instanceof Short
                || value instanceof Byte
                || value instanceof BigInteger;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private void ensureCollection() {
        collectionManager.ensureReady(collectionName, embeddingService.getDimensions(), DistanceMetric.COSINE);
    }

    private static QueryResult toQueryResult(SearchHit hit) {
        Map<String, Object> payload = hit.getPayload();
        Object text = payload.get(PayloadMerger.TEXT);
        return new QueryResult(hit.getId(), hit.getScore(), payload, text == null ? "" : text.toString());
    }
}
