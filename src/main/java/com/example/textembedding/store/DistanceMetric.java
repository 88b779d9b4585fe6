package com.example.textembedding.store;

/**
 * Vector distance functions understood by the store. Collections created by
 * this service always use {@link #COSINE}.
 */
public enum DistanceMetric {
    COSINE("Cosine"),
    DOT("Dot"),
    EUCLID("Euclid"),
    MANHATTAN("Manhattan");

    private final String qdrantName;

    DistanceMetric(String qdrantName) {
        this.qdrantName = qdrantName;
    }

    public String getQdrantName() {
        return qdrantName;
    }
}
