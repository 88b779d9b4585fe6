package com.example.textembedding.error;

/**
 * Classification of failures surfaced by the embedding service.
 * Callers use it (together with {@link TextEmbeddingException#isRetryable()})
 * to decide between retrying and aborting.
 */
public enum ErrorKind {
    INVALID_INPUT,
    RATE_LIMITED,
    PROVIDER_FAILURE,
    COLLECTION_UNAVAILABLE,
    STORAGE_WRITE,
    STORAGE_READ,
    CONTRACT_VIOLATION,
    TIMEOUT
}
