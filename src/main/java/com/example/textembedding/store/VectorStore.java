package com.example.textembedding.store;

import java.util.List;
import java.util.Map;

/**
 * Client side of the vector store capability. Implementations raise
 * {@link com.example.textembedding.error.StorageReadException},
 * {@link com.example.textembedding.error.StorageWriteException} or
 * {@link com.example.textembedding.error.OperationTimeoutException}.
 */
public interface VectorStore {

    List<String> listCollections();

    /**
     * Create a collection.
     *
     * @return {@code false} if the store reported that the collection already exists
     */
    boolean createCollection(String collectionName, int vectorSize, DistanceMetric metric);

    /**
     * Insert or replace the records as one batch; waits until the write is applied.
     */
    void upsert(String collectionName, List<EmbeddingRecord> records);

    /**
     * Nearest neighbours of {@code vector}, best first, in the store's native order.
     *
     * @param filter payload key to exact value; every entry must match. May be empty.
     */
    List<SearchHit> search(String collectionName, List<Double> vector, int limit, Map<String, Object> filter);

    long count(String collectionName);

    void delete(String collectionName, List<String> ids);
}
