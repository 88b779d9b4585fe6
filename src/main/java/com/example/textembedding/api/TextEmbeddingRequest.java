package com.example.textembedding.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for /embed and /save.
 */
public class TextEmbeddingRequest {

    private List<String> texts;

    @JsonProperty("metadata_list")
    private List<Map<String, Object>> metadataList; // optional, one entry per text

    public TextEmbeddingRequest() {}

    public TextEmbeddingRequest(List<String> texts, List<Map<String, Object>> metadataList) {
        this.texts = texts;
        this.metadataList = metadataList;
    }

    public List<String> getTexts() {
        return texts;
    }

    public void setTexts(List<String> texts) {
        this.texts = texts;
    }

    public List<Map<String, Object>> getMetadataList() {
        return metadataList;
    }

    public void setMetadataList(List<Map<String, Object>> metadataList) {
        this.metadataList = metadataList;
    }
}
