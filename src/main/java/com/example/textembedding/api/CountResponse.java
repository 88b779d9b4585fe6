package com.example.textembedding.api;

/**
 * Response DTO for /count and /delete.
 */
public class CountResponse {

    private boolean success;
    private long count;
    private String message;

    public CountResponse() {
    }

    public CountResponse(long count, String message) {
        this.success = true;
        this.count = count;
        this.message = message;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public long getCount() {
        return count;
    }

    public void setCount(long count) {
        this.count = count;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
