package com.example.textembedding.embedding;

/**
 * Semantic mode of an embedding call. Documents and queries are embedded
 * asymmetrically, so stored passages must use {@link #DOCUMENT} and search
 * input must use {@link #QUERY}.
 */
public enum EmbeddingPurpose {
    DOCUMENT("search_document"),
    QUERY("search_query");

    private final String inputType;

    EmbeddingPurpose(String inputType) {
        this.inputType = inputType;
    }

    /**
     * Value sent to the provider as {@code input_type}.
     */
    public String getInputType() {
        return inputType;
    }
}
