package com.prism.controller.rest;

import com.prism.service.core.apikey.InvalidApiKeyException;
import com.prism.service.core.ingest.IngestValidationException;
import com.prism.service.core.project.ProjectNotFoundException;
import com.prism.service.core.query.QueryValidationException;
import com.prism.service.core.ratelimit.RateLimitExceededException;
import jakarta.validation.ConstraintViolationException;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

/**
 * Global REST exception mapper. Client mistakes become 400/401/404/429 with a JSON payload; storage failures are
 * left to Spring's default handling.
 */
@ControllerAdvice
@Slf4j
public class RestErrorHandler {

    private final Clock clock;

    public RestErrorHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<ErrorPayload> handleQueryValidation(QueryValidationException ex, WebRequest request) {
        List<ErrorPayload.Detail> details = ex.violations().stream()
                .map(v -> new ErrorPayload.Detail(v.field(), v.message()))
                .toList();
        return build(HttpStatus.BAD_REQUEST, "Invalid query", details, request);
    }

    @ExceptionHandler(IngestValidationException.class)
    public ResponseEntity<ErrorPayload> handleIngestValidation(IngestValidationException ex, WebRequest request) {
        List<ErrorPayload.Detail> details = ex.violations().stream()
                .map(v -> new ErrorPayload.Detail(v.field(), v.message()))
                .toList();
        return build(HttpStatus.BAD_REQUEST, "Invalid ingest batch", details, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorPayload> handleValidation(MethodArgumentNotValidException ex, WebRequest request) {
        List<ErrorPayload.Detail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> new ErrorPayload.Detail(e.getField(), e.getDefaultMessage()))
                .sorted(Comparator.comparing(ErrorPayload.Detail::field))
                .toList();
        return build(HttpStatus.BAD_REQUEST, "Validation failed", details, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorPayload> handleConstraints(ConstraintViolationException ex, WebRequest request) {
        List<ErrorPayload.Detail> details = ex.getConstraintViolations().stream()
                .map(v -> new ErrorPayload.Detail(v.getPropertyPath().toString(), v.getMessage()))
                .sorted(Comparator.comparing(ErrorPayload.Detail::field))
                .toList();
        return build(HttpStatus.BAD_REQUEST, "Validation failed", details, request);
    }

    @ExceptionHandler(ProjectNotFoundException.class)
    public ResponseEntity<ErrorPayload> handleProjectNotFound(ProjectNotFoundException ex, WebRequest request) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), null, request);
    }

    @ExceptionHandler(InvalidApiKeyException.class)
    public ResponseEntity<ErrorPayload> handleApiKey(InvalidApiKeyException ex, WebRequest request) {
        return build(HttpStatus.UNAUTHORIZED, ex.getMessage(), null, request);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorPayload> handleRateLimit(RateLimitExceededException ex, WebRequest request) {
        return build(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), null, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorPayload> handleBadRequest(IllegalArgumentException ex, WebRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorPayload> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        log.debug("Unreadable request body", ex);
        return build(HttpStatus.BAD_REQUEST, "Malformed JSON request body", null, request);
    }

    private ResponseEntity<ErrorPayload> build(
            HttpStatus status, String message, List<ErrorPayload.Detail> details, WebRequest request) {
        String path = null;
        if (request instanceof ServletWebRequest servletRequest) {
            path = servletRequest.getRequest().getRequestURI();
        }
        ErrorPayload body =
                new ErrorPayload(clock.instant(), status.value(), status.getReasonPhrase(), message, path, details);
        return ResponseEntity.status(status).body(body);
    }
}
