package com.example.textembedding.error;

/**
 * Root of all failures raised by ingestion, retrieval and collection management.
 */
public abstract class TextEmbeddingException extends RuntimeException {

    private final ErrorKind kind;

    protected TextEmbeddingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TextEmbeddingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return false;
    }
}
