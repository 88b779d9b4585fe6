package com.example.textembedding.health;

import com.example.textembedding.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Read-only diagnostics over the vector store. Never throws: every failure is
 * folded into the returned {@link HealthReport}.
 */
public class HealthReporter {

    private static final Logger log = LoggerFactory.getLogger(HealthReporter.class);

    private final VectorStore vectorStore;
    private final String collectionName;

    public HealthReporter(VectorStore vectorStore, String collectionName) {
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
    }

    public HealthReport checkHealth() {
        List<String> collections;
        try {
            collections = vectorStore.listCollections();
        } catch (Exception e) {
            log.warn("Vector store unreachable: {}", e.getMessage());
            return new HealthReport(HealthStatus.UNHEALTHY, collectionName, false, null,
                    "Vector store unreachable: " + e.getMessage());
        }

        if (!collections.contains(collectionName)) {
            return new HealthReport(HealthStatus.DEGRADED, collectionName, false, null,
                    "Collection '" + collectionName + "' does not exist");
        }

        try {
            long count = vectorStore.count(collectionName);
            return new HealthReport(HealthStatus.HEALTHY, collectionName, true, count,
                    "Total embeddings in collection: " + count);
        } catch (Exception e) {
            log.warn("Could not count collection {}: {}", collectionName, e.getMessage());
            return new HealthReport(HealthStatus.DEGRADED, collectionName, true, null,
                    "Collection exists but count failed: " + e.getMessage());
        }
    }
}
