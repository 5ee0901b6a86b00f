package com.example.ecotravel.planner.api;

import com.example.ecotravel.planner.retrieval.KnowledgeIngestionException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures of the turn, conversation and knowledge endpoints to {@link ApiError}. Dialogue
 * problems never get here: they are answered as chat messages.
 */
@RestControllerAdvice(assignableTypes = {PlannerController.class, ConversationController.class, KnowledgeController.class})
public class PlannerExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(PlannerExceptionHandler.class);

    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String MALFORMED_BODY = "MALFORMED_BODY";
    static final String KNOWLEDGE_UNAVAILABLE = "KNOWLEDGE_UNAVAILABLE";
    static final String PLANNER_ERROR = "PLANNER_ERROR";

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message,
                                                  HttpServletRequest request, boolean retryable) {
        return ResponseEntity.status(status)
                .body(new ApiError(status.value(), code, message, request.getRequestURI(), retryable));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> malformedBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, MALFORMED_BODY, "Request body is not valid JSON for this endpoint", request, false);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> invalidRequest(Exception ex, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, INVALID_REQUEST, ex.getMessage(), request, false);
    }

    @ExceptionHandler(KnowledgeIngestionException.class)
    public ResponseEntity<ApiError> ingestionFailed(KnowledgeIngestionException ex, HttpServletRequest request) {
        log.warn("[PlannerExceptionHandler] Ingestion failed on {}: {}", request.getRequestURI(), ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, KNOWLEDGE_UNAVAILABLE,
                "Embedding service unavailable, nothing was ingested", request, true);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> unexpected(Exception ex, HttpServletRequest request) {
        log.warn("[PlannerExceptionHandler] Unhandled error on {}: {}", request.getRequestURI(), ex.toString(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, PLANNER_ERROR, "Internal error", request, true);
    }
}
