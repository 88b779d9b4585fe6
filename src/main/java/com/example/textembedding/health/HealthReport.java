package com.example.textembedding.health;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of store connectivity. {@code recordCount} is null when unknown.
 */
public record HealthReport(HealthStatus status,
                           @JsonProperty("collection_name") String collectionName,
                           @JsonProperty("collection_exists") boolean collectionExists,
                           @JsonProperty("record_count") Long recordCount,
                           String detail) {
}
