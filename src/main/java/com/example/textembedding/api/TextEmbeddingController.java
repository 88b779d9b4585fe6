package com.example.textembedding.api;

import com.example.textembedding.config.TextEmbeddingProperties;
import com.example.textembedding.health.HealthReport;
import com.example.textembedding.health.HealthReporter;
import com.example.textembedding.health.HealthStatus;
import com.example.textembedding.ingest.IngestionService;
import com.example.textembedding.retrieval.QueryResult;
import com.example.textembedding.retrieval.RetrievalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller over ingestion, retrieval and health.
 *
 * POST /api/embeddings/save
 * {
 *   "texts": ["A cat sleeps", "A dog barks"],
 *   "metadata_list": [{"category": "animals"}, {"category": "animals"}]
 * }
 *
 * POST /api/embeddings/search
 * { "query_text": "feline napping", "top_k": 1 }
 */
@RestController
@RequestMapping("/api/embeddings")
public class TextEmbeddingController {

    private static final Logger log = LoggerFactory.getLogger(TextEmbeddingController.class);

    private final IngestionService ingestionService;
    private final RetrievalService retrievalService;
    private final HealthReporter healthReporter;
    private final int defaultTopK;

    public TextEmbeddingController(IngestionService ingestionService,
                                   RetrievalService retrievalService,
                                   HealthReporter healthReporter,
                                   TextEmbeddingProperties properties) {
        this.ingestionService = ingestionService;
        this.retrievalService = retrievalService;
        this.healthReporter = healthReporter;
        this.defaultTopK = properties.getRetrieval().getDefaultTopK();
    }

    @PostMapping("/embed")
    public TextEmbeddingResponse embed(@RequestBody TextEmbeddingRequest request) {
        log.info("Processing embedding request for {} texts", sizeOf(request.getTexts()));
        return TextEmbeddingResponse.embedded(ingestionService.embedTexts(request.getTexts()));
    }

    @PostMapping("/save")
    public TextEmbeddingResponse save(@RequestBody TextEmbeddingRequest request) {
        log.info("Processing save request for {} texts", sizeOf(request.getTexts()));
        List<String> ids = ingestionService.saveTexts(request.getTexts(), request.getMetadataList());
        return TextEmbeddingResponse.saved(ids);
    }

    @PostMapping("/search")
    public SimilaritySearchResponse search(@RequestBody SimilaritySearchRequest request) {
        int topK = request.getTopK() == null ? defaultTopK : request.getTopK();
        List<QueryResult> results = retrievalService.retrieve(request.getQueryText(), topK, request.getFilters());
        return new SimilaritySearchResponse(request.getQueryText(), results);
    }

    @GetMapping("/count")
    public CountResponse count() {
        long count = retrievalService.countRecords();
        return new CountResponse(count, "Total embeddings in collection: " + count);
    }

    @PostMapping("/delete")
    public CountResponse delete(@RequestBody DeleteRequest request) {
        int deleted = ingestionService.deleteRecords(request.getIds());
        return new CountResponse(deleted, "Successfully deleted " + deleted + " embeddings");
    }

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = healthReporter.checkHealth();
        HttpStatus status = report.status() == HealthStatus.UNHEALTHY
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
