package com.example.textembedding.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted point: id, embedding vector and payload (metadata).
 * Immutable once built.
 */
public final class EmbeddingRecord {

    private final String id; // UUID string, Qdrant accepts UUIDs or unsigned integers
    private final List<Double> vector;
    private final Map<String, Object> payload;

    public EmbeddingRecord(String id, List<Double> vector, Map<String, Object> payload) {
        this.id = Objects.requireNonNull(id, "id");
        this.vector = List.copyOf(vector);
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public String getId() {
        return id;
    }

    public List<Double> getVector() {
        return vector;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "EmbeddingRecord{" +
                "id='" + id + '\'' +
                ", dimensions=" + vector.size() +
                ", payload=" + payload +
                '}';
    }
}
