package com.example.textembedding.collection;

import com.example.textembedding.error.CollectionUnavailableException;
import com.example.textembedding.error.OperationTimeoutException;
import com.example.textembedding.error.StorageException;
import com.example.textembedding.store.DistanceMetric;
import com.example.textembedding.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Makes sure a collection exists before it is read or written.
 * <p>
 * Readiness is cached per collection name for the lifetime of the process.
 * An existing collection is accepted as-is; its size and metric are not
 * compared with the requested ones.
 */
public class CollectionManager {

    private static final Logger log = LoggerFactory.getLogger(CollectionManager.class);

    private final VectorStore vectorStore;
    private final Map<String, CollectionState> states = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public CollectionManager(VectorStore vectorStore) {
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
    }

    /**
     * Create the collection if it does not exist. Idempotent and safe to call concurrently.
     *
     * @throws CollectionUnavailableException if existence could not be confirmed
     * @throws OperationTimeoutException      if the store did not answer in time
     */
    public void ensureReady(String collectionName, int vectorSize, DistanceMetric metric) {
        if (state(collectionName) == CollectionState.READY) {
            return;
        }
        synchronized (lockFor(collectionName)) {
            if (state(collectionName) == CollectionState.READY) {
                return;
            }
            try {
                states.put(collectionName, CollectionState.CHECKING);
                List<String> existing = vectorStore.listCollections();

                if (existing.contains(collectionName)) {
                    log.info("Qdrant collection already exists: {}", collectionName);
                } else {
                    states.put(collectionName, CollectionState.CREATING);
                    boolean created = vectorStore.createCollection(collectionName, vectorSize, metric);
                    if (created) {
                        log.info("Created Qdrant collection {} (size={}, distance={})",
                                collectionName, vectorSize, metric);
                    } else {
                        log.info("Qdrant collection {} was created concurrently", collectionName);
                    }
                }
                states.put(collectionName, CollectionState.EXISTS);
                states.put(collectionName, CollectionState.READY);
            } catch (OperationTimeoutException e) {
                states.put(collectionName, CollectionState.UNAVAILABLE);
                throw e;
            } catch (RuntimeException e) {
                states.put(collectionName, CollectionState.UNAVAILABLE);
                log.error("Error ensuring collection {} exists: {}", collectionName, e.getMessage());
                throw new CollectionUnavailableException(collectionName, e);
            }
        }
    }

    public CollectionState state(String collectionName) {
        return states.getOrDefault(collectionName, CollectionState.UNKNOWN);
    }

    /**
     * Forget cached readiness so that the next {@link #ensureReady} re-checks the store.
     * Waits for an in-flight check on the same collection, which would otherwise
     * overwrite the invalidation with READY.
     */
    public void invalidate(String collectionName) {
        synchronized (lockFor(collectionName)) {
            CollectionState previous = states.remove(collectionName);
            if (previous != null) {
                log.debug("Readiness of collection {} invalidated (was {})", collectionName, previous);
            }
        }
    }

    /**
     * Invalidate readiness if {@code failure} shows the store could not be reached
     * or no longer has the collection.
     */
    public void onFailure(String collectionName, RuntimeException failure) {
        if (failure instanceof OperationTimeoutException
                || (failure instanceof StorageException storageException && storageException.isConnectionFailure())) {
            log.warn("Connectivity failure on collection {}: {}", collectionName, failure.getMessage());
            invalidate(collectionName);
        } else if (failure instanceof StorageException storageFailure && storageFailure.isCollectionMissing()) {
            log.warn("Collection {} disappeared from the store: {}", collectionName, failure.getMessage());
            invalidate(collectionName);
        }
    }

    private Object lockFor(String collectionName) {
        return locks.computeIfAbsent(collectionName, name -> new Object());
    }
}
