package com.example.textembedding.api;

import com.example.textembedding.retrieval.QueryResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class SimilaritySearchResponse {

    private boolean success;
    private String message;
    private List<QueryResult> results;

    @JsonProperty("query_text")
    private String queryText;

    public SimilaritySearchResponse() {
    }

    public SimilaritySearchResponse(String queryText, List<QueryResult> results) {
        this.success = true;
        this.message = "Successfully found " + results.size() + " similar embeddings";
        this.results = results;
        this.queryText = queryText;
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

    public List<QueryResult> getResults() {
        return results;
    }

    public void setResults(List<QueryResult> results) {
        this.results = results;
    }

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }
}
