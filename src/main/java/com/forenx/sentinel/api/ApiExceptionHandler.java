package com.forenx.sentinel.api;

import com.forenx.sentinel.config.ClassifierConfigException;
import com.forenx.sentinel.domain.ErrorKind;
import com.forenx.sentinel.domain.SentinelException;
import com.forenx.sentinel.normalization.parsers.ParseException;
import com.forenx.sentinel.query.QueryValidationException;
import com.forenx.sentinel.storage.StorageWriteException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps failures to {@link ErrorResponse} bodies. Known failures keep their {@link ErrorKind};
 * anything else is reported as {@code internal} without internals leaking to the client.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final String CONFIG_PATH = "/api/config/";

    @ExceptionHandler(StorageWriteException.class)
    public ResponseEntity<ErrorResponse> handleStorageWrite(StorageWriteException ex) {
        log.error("Storage write failure for {}: {}", ex.getSourceFileId(), ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex.getSourceFileId() != null) {
            details.put("source_file_id", ex.getSourceFileId());
            details.put("first_unacknowledged_offset", ex.getFirstUnacknowledgedOffset());
        }
        return respond(ex.getErrorKind(), ex.getMessage(), details);
    }

    @ExceptionHandler(ClassifierConfigException.class)
    public ResponseEntity<ErrorResponse> handleClassifierConfig(ClassifierConfigException ex) {
        log.warn("Configuration rejected: {}", ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex.getDefinition() != null) {
            details.put("definition", ex.getDefinition());
        }
        return respond(ex.getErrorKind(), ex.getMessage(), details);
    }

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<ErrorResponse> handleQueryValidation(QueryValidationException ex) {
        log.debug("Invalid query: {}", ex.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex.getParameter() != null) {
            details.put("parameter", ex.getParameter());
        }
        return respond(ex.getErrorKind(), ex.getMessage(), details);
    }

    @ExceptionHandler(ParseException.class)
    public ResponseEntity<ErrorResponse> handleParse(ParseException ex) {
        return respond(ex.getErrorKind(), ex.getMessage(), Map.of("parse_error_kind", ex.getKind()));
    }

    @ExceptionHandler(SentinelException.class)
    public ResponseEntity<ErrorResponse> handleSentinel(SentinelException ex) {
        log.warn("{}: {}", ex.getErrorKind().getValue(), ex.getMessage());
        return respond(ex.getErrorKind(), ex.getMessage(), Map.of());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return respond(ErrorKind.INVALID_QUERY, "Missing required parameter '" + ex.getParameterName() + "'",
            Map.of("parameter", ex.getParameterName()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return respond(ErrorKind.INVALID_QUERY, "Parameter '" + ex.getName() + "' has an invalid value: " + ex.getValue(),
            Map.of("parameter", ex.getName()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        // Only configuration updates carry classifier settings in their body
        ErrorKind kind = request.getRequestURI().startsWith(CONFIG_PATH)
            ? ErrorKind.CLASSIFIER_CONFIG_ERROR
            : ErrorKind.INVALID_QUERY;
        return respond(kind, "Request body is not valid: " + ex.getMostSpecificCause().getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(ErrorKind.INTERNAL, "Internal error", Map.of());
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorKind kind, String message, Map<String, Object> details) {
        return ResponseEntity.status(kind.getHttpStatus())
            .body(new ErrorResponse(kind, message, Instant.now(), details));
    }
}
