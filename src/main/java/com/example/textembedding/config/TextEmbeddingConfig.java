package com.example.textembedding.config;

import com.example.textembedding.collection.CollectionManager;
import com.example.textembedding.embedding.CohereEmbeddingClient;
import com.example.textembedding.embedding.EmbeddingProvider;
import com.example.textembedding.embedding.EmbeddingService;
import com.example.textembedding.health.HealthReporter;
import com.example.textembedding.ingest.IngestionService;
import com.example.textembedding.retrieval.RetrievalService;
import com.example.textembedding.store.QdrantService;
import com.example.textembedding.store.VectorStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration that wires the embedding service components as beans.
 * Missing credentials fail startup.
 */
@Configuration
@EnableConfigurationProperties(TextEmbeddingProperties.class)
public class TextEmbeddingConfig {

    @Bean
    public EmbeddingProvider embeddingProvider(TextEmbeddingProperties properties) {
        TextEmbeddingProperties.Embedding embedding = properties.getEmbedding();
        requireText(embedding.getApiKey(), "rag.embedding.api-key (COHERE_API_KEY)");
        return new CohereEmbeddingClient(embedding.getBaseUrl(), embedding.getApiKey(),
                embedding.getModel(), embedding.getTimeout());
    }

    @Bean
    public VectorStore vectorStore(TextEmbeddingProperties properties) {
        TextEmbeddingProperties.Store store = properties.getStore();
        requireText(store.getUrl(), "rag.store.url (QDRANT_URL)");
        requireText(store.getApiKey(), "rag.store.api-key (QDRANT_API_KEY)");
        requireText(store.getCollectionName(), "rag.store.collection-name");
        return new QdrantService(store.getUrl(), store.getApiKey(), store.getTimeout());
    }

    @Bean
    public EmbeddingService embeddingService(EmbeddingProvider embeddingProvider, TextEmbeddingProperties properties) {
        return new EmbeddingService(embeddingProvider, properties.getEmbedding().getDimensions());
    }

    @Bean
    public CollectionManager collectionManager(VectorStore vectorStore) {
        return new CollectionManager(vectorStore);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IngestionService ingestionService(VectorStore vectorStore,
                                             CollectionManager collectionManager,
                                             EmbeddingService embeddingService,
                                             TextEmbeddingProperties properties,
                                             Clock clock) {
        return new IngestionService(vectorStore, collectionManager, embeddingService,
                properties.getStore().getCollectionName(), properties.getIngest().getMaxBatchSize(), clock);
    }

    @Bean
    public RetrievalService retrievalService(VectorStore vectorStore,
                                             CollectionManager collectionManager,
                                             EmbeddingService embeddingService,
                                             TextEmbeddingProperties properties) {
        return new RetrievalService(vectorStore, collectionManager, embeddingService,
                properties.getStore().getCollectionName(), properties.getRetrieval().getMaxTopK());
    }

    @Bean
    public HealthReporter healthReporter(VectorStore vectorStore, TextEmbeddingProperties properties) {
        return new HealthReporter(vectorStore, properties.getStore().getCollectionName());
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(name + " is not set");
        }
    }
}
