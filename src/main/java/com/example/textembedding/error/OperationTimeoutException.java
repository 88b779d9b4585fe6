package com.example.textembedding.error;

/**
 * A network call exceeded its deadline.
 */
public class OperationTimeoutException extends TextEmbeddingException {

    public OperationTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
