package com.example.textembedding.error;

/**
 * The collection could not be confirmed or created. Fatal for the current
 * call; the next call re-checks the store.
 */
public class CollectionUnavailableException extends TextEmbeddingException {

    private final String collectionName;

    public CollectionUnavailableException(String collectionName, Throwable cause) {
        super(ErrorKind.COLLECTION_UNAVAILABLE,
                "Collection '" + collectionName + "' is unavailable: " + cause.getMessage(), cause);
        this.collectionName = collectionName;
    }

    public String getCollectionName() {
        return collectionName;
    }
}
