package com.example.textembedding.error;

/**
 * Failure reported by the external embedding provider.
 */
public abstract class EmbeddingProviderException extends TextEmbeddingException {

    private final int statusCode;

    protected EmbeddingProviderException(ErrorKind kind, String message, int statusCode, Throwable cause) {
        super(kind, message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the provider, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
