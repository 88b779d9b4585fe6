package com.example.textembedding.config;

import com.example.textembedding.embedding.CohereEmbeddingClient;
import com.example.textembedding.store.QdrantService;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection and limit settings, bound from {@code rag.*}.
 */
@ConfigurationProperties(prefix = "rag")
public class TextEmbeddingProperties {

    private final Embedding embedding = new Embedding();
    private final Store store = new Store();
    private final Retrieval retrieval = new Retrieval();
    private final Ingest ingest = new Ingest();

    public Embedding getEmbedding() {
        return embedding;
    }

    public Store getStore() {
        return store;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public static class Embedding {

        /**
         * Cohere API key.
         */
        private String apiKey;

        private String baseUrl = CohereEmbeddingClient.DEFAULT_BASE_URL;

        private String model = CohereEmbeddingClient.DEFAULT_MODEL;

        /**
         * Vector size produced by the model; also the size of new collections.
         */
        private int dimensions = 1024;

        private Duration timeout = Duration.ofSeconds(30);

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getDimensions() {
            return dimensions;
        }

        public void setDimensions(int dimensions) {
            this.dimensions = dimensions;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Store {

        private String url = QdrantService.DEFAULT_HOST;

        private String apiKey;

        private String collectionName = "text_embeddings";

        private Duration timeout = Duration.ofSeconds(10);

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getCollectionName() {
            return collectionName;
        }

        public void setCollectionName(String collectionName) {
            this.collectionName = collectionName;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Retrieval {

        private int defaultTopK = 5;

        private int maxTopK = 100;

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public int getMaxTopK() {
            return maxTopK;
        }

        public void setMaxTopK(int maxTopK) {
            this.maxTopK = maxTopK;
        }
    }

    public static class Ingest {

        private int maxBatchSize = 100;

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }
    }
}
