package com.example.textembedding.store;

import java.util.Map;

/**
 * Holds a single nearest-neighbour hit with id, score and payload.
 */
public class SearchHit {

    private final String id;
    private final double score;
    private final Map<String, Object> payload;

    public SearchHit(String id, double score, Map<String, Object> payload) {
        this.id = id;
        this.score = score;
        this.payload = payload == null ? Map.of() : payload;
    }

    public String getId() {
        return id;
    }

    public double getScore() {
        return score;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "SearchHit{" +
                "id='" + id + '\'' +
                ", score=" + score +
                ", payload=" + payload +
                '}';
    }
}
