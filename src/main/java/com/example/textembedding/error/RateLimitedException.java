package com.example.textembedding.error;

public class RateLimitedException extends EmbeddingProviderException {

    public RateLimitedException(String message, int statusCode) {
        super(ErrorKind.RATE_LIMITED, message, statusCode, null);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
