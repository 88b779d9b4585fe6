package com.example.textembedding.embedding;

import java.util.List;

/**
 * External capability that turns texts into vectors.
 */
public interface EmbeddingProvider {

    /**
     * Embed the texts in one provider call.
     *
     * @param texts   texts to embed, in order
     * @param purpose document or query mode
     * @return one vector per text as returned by the provider, unvalidated
     */
    List<List<Double>> embed(List<String> texts, EmbeddingPurpose purpose);

    /**
     * Identifier of the model used for every call.
     */
    String modelId();
}
