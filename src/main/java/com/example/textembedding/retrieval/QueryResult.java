package com.example.textembedding.retrieval;

import java.util.Map;

/**
 * One ranked hit of a similarity query. {@code text} is taken from the
 * payload, empty when the payload has none.
 */
public record QueryResult(String id, double score, Map<String, Object> payload, String text) {
}
