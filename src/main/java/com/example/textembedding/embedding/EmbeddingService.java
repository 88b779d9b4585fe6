package com.example.textembedding.embedding;

import com.example.textembedding.error.ContractViolationException;
import com.example.textembedding.error.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Guards the embedding provider: validates input, and checks that the provider
 * returned exactly one vector of the configured dimensionality per text.
 * No caching, every call goes to the provider.
 */
public class EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingService.class);

    private final EmbeddingProvider provider;
    private final int dimensions;

    public EmbeddingService(EmbeddingProvider provider, int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.provider = Objects.requireNonNull(provider, "provider");
        this.dimensions = dimensions;
    }

    public int getDimensions() {
        return dimensions;
    }

    public List<List<Double>> embed(List<String> texts, EmbeddingPurpose purpose) {
        Objects.requireNonNull(purpose, "purpose");
        if (texts == null || texts.isEmpty()) {
            throw new InvalidInputException("Texts list cannot be empty");
        }
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text == null || text.isBlank()) {
                throw new InvalidInputException("Text at index " + i + " cannot be empty");
            }
        }

        log.debug("Generating {} embeddings (model={}, purpose={})", texts.size(), provider.modelId(), purpose);
        List<List<Double>> vectors = provider.embed(texts, purpose);

        if (vectors == null || vectors.size() != texts.size()) {
            int returned = vectors == null ? 0 : vectors.size();
            log.error("Embedding provider returned {} vectors for {} texts", returned, texts.size());
            throw new ContractViolationException("Expected " + texts.size()
                    + " embeddings but provider returned " + returned);
        }
        for (int i = 0; i < vectors.size(); i++) {
            List<Double> vector = vectors.get(i);
            int size = vector == null ? 0 : vector.size();
            if (size != dimensions) {
                log.error("Embedding provider returned vector of dimension {} at index {}, expected {}",
                        size, i, dimensions);
                throw new ContractViolationException("Embedding at index " + i + " has dimension "
                        + size + ", expected " + dimensions);
            }
        }
        return vectors;
    }

    public List<Double> embedOne(String text, EmbeddingPurpose purpose) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Text cannot be empty");
        }
        return embed(List.of(text), purpose).get(0);
    }
}
