package com.example.textembedding.error;

public class ProviderFailureException extends EmbeddingProviderException {

    public ProviderFailureException(String message, int statusCode) {
        super(ErrorKind.PROVIDER_FAILURE, message, statusCode, null);
    }

    public ProviderFailureException(String message, Throwable cause) {
        super(ErrorKind.PROVIDER_FAILURE, message, -1, cause);
    }
}
