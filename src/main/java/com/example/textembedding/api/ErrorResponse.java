package com.example.textembedding.api;

import com.example.textembedding.error.ErrorKind;

/**
 * Error body: kind, message and whether the caller may retry.
 */
public class ErrorResponse {

    private ErrorKind error;
    private String message;
    private boolean retryable;

    public ErrorResponse() {
    }

    public ErrorResponse(ErrorKind error, String message, boolean retryable) {
        this.error = error;
        this.message = message;
        this.retryable = retryable;
    }

    public ErrorKind getError() {
        return error;
    }

    public void setError(ErrorKind error) {
        this.error = error;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public void setRetryable(boolean retryable) {
        this.retryable = retryable;
    }
}
