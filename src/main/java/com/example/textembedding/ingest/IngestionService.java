package com.example.textembedding.ingest;

import com.example.textembedding.collection.CollectionManager;
import com.example.textembedding.embedding.EmbeddingPurpose;
import com.example.textembedding.embedding.EmbeddingService;
import com.example.textembedding.error.InvalidInputException;
import com.example.textembedding.store.DistanceMetric;
import com.example.textembedding.store.EmbeddingRecord;
import com.example.textembedding.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns raw text plus caller metadata into persisted records:
 * ensure collection, embed as documents, assign ids, merge payload, upsert.
 * A batch is embedded in one provider call and written in one upsert, so it
 * either fully succeeds or saves nothing.
 */
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final VectorStore vectorStore;
    private final CollectionManager collectionManager;
    private final EmbeddingService embeddingService;
    private final String collectionName;
    private final int maxBatchSize;
    private final Clock clock;

    public IngestionService(VectorStore vectorStore,
                            CollectionManager collectionManager,
                            EmbeddingService embeddingService,
                            String collectionName,
                            int maxBatchSize,
                            Clock clock) {
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.collectionManager = Objects.requireNonNull(collectionManager, "collectionManager");
        this.embeddingService = Objects.requireNonNull(embeddingService, "embeddingService");
        this.collectionName = Objects.requireNonNull(collectionName, "collectionName");
        this.maxBatchSize = maxBatchSize;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String saveText(String text, Map<String, Object> metadata) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Text cannot be empty");
        }
        return saveTexts(List.of(text), Collections.singletonList(metadata)).get(0);
    }

    public List<String> saveTexts(List<String> texts, List<Map<String, Object>> metadataList) {
        validateTexts(texts);
        if (metadataList != null && metadataList.size() != texts.size()) {
            throw new InvalidInputException("Number of metadata entries (" + metadataList.size()
                    + ") must match number of texts (" + texts.size() + ")");
        }

        ensureCollection();
        List<List<Double>> embeddings = embeddingService.embed(texts, EmbeddingPurpose.DOCUMENT);

        String createdAt = Instant.now(clock).toString();
        List<String> ids = new ArrayList<>(texts.size());
        List<EmbeddingRecord> records = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String id = UUID.randomUUID().toString();
            Map<String, Object> metadata = metadataList == null ? null : metadataList.get(i);
            Map<String, Object> payload = PayloadMerger.merge(metadata,
                    PayloadMerger.defaults(texts.get(i), createdAt, id));
            ids.add(id);
            records.add(new EmbeddingRecord(id, embeddings.get(i), payload));
        }

        try {
            vectorStore.upsert(collectionName, records);
        } catch (RuntimeException e) {
            collectionManager.onFailure(collectionName, e);
            throw e;
        }
        log.info("Saved {} embeddings to collection {}", records.size(), collectionName);
        return ids;
    }

    /**
     * Embed texts as documents without persisting them.
     */
    public List<List<Double>> embedTexts(List<String> texts) {
        validateTexts(texts);
        return embeddingService.embed(texts, EmbeddingPurpose.DOCUMENT);
    }

    /**
     * Delete records by id.
     *
     * @return number of ids submitted for deletion
     */
    public int deleteRecords(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new InvalidInputException("IDs list cannot be empty");
        }
        for (String id : ids) {
            if (id == null || id.isBlank()) {
                throw new InvalidInputException("IDs cannot be blank");
            }
        }

        ensureCollection();
        try {
            vectorStore.delete(collectionName, ids);
        } catch (RuntimeException e) {
            collectionManager.onFailure(collectionName, e);
            throw e;
        }
        log.info("Deleted {} embeddings from collection {}", ids.size(), collectionName);
        return ids.size();
    }

    private void validateTexts(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            throw new InvalidInputException("Texts list cannot be empty");
        }
        if (texts.size() > maxBatchSize) {
            throw new InvalidInputException("Too many texts provided (max " + maxBatchSize + ")");
        }
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            if (text == null || text.isBlank()) {
                throw new InvalidInputException("Text at index " + i + " cannot be empty");
            }
        }
    }

    private void ensureCollection() {
        collectionManager.ensureReady(collectionName, embeddingService.getDimensions(), DistanceMetric.COSINE);
    }
}
