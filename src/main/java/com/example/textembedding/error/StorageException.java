package com.example.textembedding.error;

/**
 * Failure of a vector store operation.
 */
public abstract class StorageException extends TextEmbeddingException {

    private final boolean connectionFailure;
    private final boolean collectionMissing;

    protected StorageException(ErrorKind kind, String message, boolean connectionFailure,
                               boolean collectionMissing, Throwable cause) {
        super(kind, message, cause);
        this.connectionFailure = connectionFailure;
        this.collectionMissing = collectionMissing;
    }

    /**
     * True when the store could not be reached at all, as opposed to the store
     * answering with an error.
     */
    public boolean isConnectionFailure() {
        return connectionFailure;
    }

    /**
     * True when the store answered that the target collection does not exist.
     */
    public boolean isCollectionMissing() {
        return collectionMissing;
    }
}
