package com.example.textembedding.api;

import com.example.textembedding.config.TextEmbeddingProperties;
import com.example.textembedding.error.InvalidInputException;
import com.example.textembedding.error.RateLimitedException;
import com.example.textembedding.error.StorageWriteException;
import com.example.textembedding.health.HealthReport;
import com.example.textembedding.health.HealthReporter;
import com.example.textembedding.health.HealthStatus;
import com.example.textembedding.ingest.IngestionService;
import com.example.textembedding.retrieval.QueryResult;
import com.example.textembedding.retrieval.RetrievalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TextEmbeddingControllerTest {

    private final IngestionService ingestionService = mock(IngestionService.class);
    private final RetrievalService retrievalService = mock(RetrievalService.class);
    private final HealthReporter healthReporter = mock(HealthReporter.class);

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        TextEmbeddingController controller = new TextEmbeddingController(ingestionService, retrievalService,
                healthReporter, new TextEmbeddingProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void saveReturnsGeneratedIds() throws Exception {
        when(ingestionService.saveTexts(eq(List.of("A cat sleeps", "A dog barks")), anyList()))
                .thenReturn(List.of("id-1", "id-2"));

        mockMvc.perform(post("/api/embeddings/save")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"texts": ["A cat sleeps", "A dog barks"],
                                 "metadata_list": [{"category": "animals"}, {"category": "animals"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.ids[1]").value("id-2"))
                .andExpect(jsonPath("$.count").value(2));
    }

    @Test
    void searchUsesDefaultTopKWhenAbsent() throws Exception {
        when(retrievalService.retrieve(eq("feline napping"), eq(5), isNull()))
                .thenReturn(List.of(new QueryResult("id-1", 0.87, Map.of("text", "A cat sleeps"), "A cat sleeps")));

        mockMvc.perform(post("/api/embeddings/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query_text\": \"feline napping\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query_text").value("feline napping"))
                .andExpect(jsonPath("$.results[0].id").value("id-1"))
                .andExpect(jsonPath("$.results[0].text").value("A cat sleeps"))
                .andExpect(jsonPath("$.results[0].score").value(0.87));
    }

    @Test
    void invalidInputMapsToBadRequest() throws Exception {
        when(retrievalService.retrieve(eq(""), eq(3), any()))
                .thenThrow(new InvalidInputException("Query text cannot be empty"));

        mockMvc.perform(post("/api/embeddings/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query_text\": \"\", \"top_k\": 3}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void rateLimitMapsToTooManyRequestsAndIsRetryable() throws Exception {
        when(ingestionService.embedTexts(anyList())).thenThrow(new RateLimitedException("rate limited", 429));

        mockMvc.perform(post("/api/embeddings/embed")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"texts\": [\"a\"]}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.retryable").value(true));
    }

    @Test
    void storageFailureMapsToBadGateway() throws Exception {
        when(ingestionService.deleteRecords(List.of("x"))).thenThrow(new StorageWriteException("Failed to delete"));

        mockMvc.perform(post("/api/embeddings/delete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ids\": [\"x\"]}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("STORAGE_WRITE"));
    }

    @Test
    void countReportsRecordCount() throws Exception {
        when(retrievalService.countRecords()).thenReturn(12L);

        mockMvc.perform(get("/api/embeddings/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(12));
    }

    @Test
    void unhealthyStoreIsServiceUnavailable() throws Exception {
        when(healthReporter.checkHealth()).thenReturn(new HealthReport(HealthStatus.UNHEALTHY, "text_embeddings",
                false, null, "Vector store unreachable"));

        mockMvc.perform(get("/api/embeddings/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("UNHEALTHY"));
    }

    @Test
    void healthyReportUsesSnakeCaseFields() throws Exception {
        when(healthReporter.checkHealth()).thenReturn(new HealthReport(HealthStatus.HEALTHY, "text_embeddings",
                true, 42L, "ok"));

        mockMvc.perform(get("/api/embeddings/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("HEALTHY"))
                .andExpect(jsonPath("$.collection_exists").value(true))
                .andExpect(jsonPath("$.record_count").value(42));
    }

    @Test
    void degradedStoreIsStillOk() throws Exception {
        when(healthReporter.checkHealth()).thenReturn(new HealthReport(HealthStatus.DEGRADED, "text_embeddings",
                false, null, "Collection 'text_embeddings' does not exist"));

        mockMvc.perform(get("/api/embeddings/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.collection_name").value("text_embeddings"))
                .andExpect(jsonPath("$.collection_exists").value(false))
                .andExpect(jsonPath("$.collectionExists").doesNotExist());
    }
}
