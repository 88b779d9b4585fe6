package com.example.textembedding.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request DTO for /search.
 */
public class SimilaritySearchRequest {

    @JsonProperty("query_text")
    private String queryText;

    @JsonProperty("top_k")
    private Integer topK; // optional, service default when absent

    private Map<String, Object> filters; // optional exact-match payload filter

    public SimilaritySearchRequest() {}

    public SimilaritySearchRequest(String queryText, Integer topK) {
        this.queryText = queryText;
        this.topK = topK;
    }

    public String getQueryText() {
        return queryText;
    }

    public void setQueryText(String queryText) {
        this.queryText = queryText;
    }

    public Integer getTopK() {
        return topK;
    }

    public void setTopK(Integer topK) {
        this.topK = topK;
    }

    public Map<String, Object> getFilters() {
        return filters;
    }

    public void setFilters(Map<String, Object> filters) {
        this.filters = filters;
    }
}
