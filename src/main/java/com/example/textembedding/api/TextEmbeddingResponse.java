package com.example.textembedding.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Response DTO for /embed and /save. Only one of {@code embeddings} and
 * {@code ids} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TextEmbeddingResponse {

    private boolean success;
    private String message;
    private List<List<Double>> embeddings;
    private List<String> ids;
    private Integer count;

    public TextEmbeddingResponse() {
    }

    public static TextEmbeddingResponse embedded(List<List<Double>> embeddings) {
        TextEmbeddingResponse response = new TextEmbeddingResponse();
        response.success = true;
        response.message = "Successfully generated " + embeddings.size() + " embeddings";
        response.embeddings = embeddings;
        response.count = embeddings.size();
        return response;
    }

    public static TextEmbeddingResponse saved(List<String> ids) {
        TextEmbeddingResponse response = new TextEmbeddingResponse();
        response.success = true;
        response.message = "Successfully saved " + ids.size() + " embeddings";
        response.ids = ids;
        response.count = ids.size();
        return response;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public List<List<Double>> getEmbeddings() {
        return embeddings;
    }

    public void setEmbeddings(List<List<Double>> embeddings) {
        this.embeddings = embeddings;
    }

    public List<String> getIds() {
        return ids;
    }

    public void setIds(List<String> ids) {
        this.ids = ids;
    }

    public Integer getCount() {
        return count;
    }

    public void setCount(Integer count) {
        this.count = count;
    }
}
