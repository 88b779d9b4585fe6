package com.example.textembedding.collection;

/**
 * Readiness of a collection as seen by this process.
 * {@code UNKNOWN -> CHECKING -> (EXISTS | CREATING -> EXISTS) -> READY},
 * with {@code UNAVAILABLE} after a failed check or create.
 */
public enum CollectionState {
    UNKNOWN,
    CHECKING,
    CREATING,
    EXISTS,
    READY,
    UNAVAILABLE
}
