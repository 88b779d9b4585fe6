package com.example.textembedding.api;

import com.example.textembedding.error.TextEmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps {@link TextEmbeddingException} kinds to HTTP statuses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TextEmbeddingException.class)
    public ResponseEntity<ErrorResponse> handle(TextEmbeddingException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case COLLECTION_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.BAD_GATEWAY;
        };
        if (status == HttpStatus.BAD_REQUEST) {
            log.info("Rejected request: {}", ex.getMessage());
        } else {
            log.error("Request failed with {}: {}", ex.getKind(), ex.getMessage(), ex);
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(ex.getKind(), ex.getMessage(), ex.isRetryable()));
    }
}
