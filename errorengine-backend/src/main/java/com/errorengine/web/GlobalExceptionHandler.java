package com.errorengine.web;

import com.errorengine.api.ErrorResponse;
import com.errorengine.config.ConfigurationException;
import com.errorengine.monitor.ErrorNotFoundException;
import com.errorengine.monitor.QueryNotFoundException;
import com.errorengine.source.SourceException;
import com.errorengine.store.StoreException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String TRACE_ID = "trace_id";
    private static final String QUERY_ID = "query_id";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfigurationException(ConfigurationException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_DEFINITION", ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request body could not be read",
                ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler({QueryNotFoundException.class, ErrorNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleMissingEntity(RuntimeException ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(SourceException.class)
    public ResponseEntity<ErrorResponse> handleSourceException(SourceException ex) {
        log.warn("Source error: kind={}, message={}", ex.getKind(), ex.getMessage());
        ErrorResponse error = body("SOURCE_" + ex.getKind().name(), ex.getMessage(), null);
        error.setSourceErrorKind(ex.getKind().name());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(error);
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreException(StoreException ex) {
        log.error("State store error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "STORE_ERROR", "A state store error occurred", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred",
                ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(body(code, message, details));
    }

    private static ErrorResponse body(String code, String message, String details) {
        String queryId = MDC.get(QUERY_ID);
        return ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .queryId(queryId != null ? Long.valueOf(queryId) : null)
                .traceId(MDC.get(TRACE_ID))
                .build();
    }
}
