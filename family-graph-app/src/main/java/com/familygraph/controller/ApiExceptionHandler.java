package com.familygraph.controller;

import com.familygraph.graph.DuplicateEdgeException;
import com.familygraph.graph.NotFoundException;
import com.familygraph.graph.SnapshotPersistenceException;
import com.familygraph.graph.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps graph errors to HTTP statuses: validation 400, unknown ids 404, duplicate edges 409,
 * and a failed snapshot write 500 with the committed result attached.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException e, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage(), request, null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", e.getKind());
        details.put("id", e.getId());
        return respond(HttpStatus.NOT_FOUND, e.getMessage(), request, details);
    }

    @ExceptionHandler(DuplicateEdgeException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateEdgeException e, HttpServletRequest request) {
        Map<String, Object> details = Map.of("existingId", e.getExistingId());
        return respond(HttpStatus.CONFLICT, e.getMessage(), request, details);
    }

    @ExceptionHandler(SnapshotPersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(SnapshotPersistenceException e, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("committed", true);
        details.put("version", e.getVersion());
        details.put("result", e.getCommitted());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), request, details);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e, HttpServletRequest request) {
        log.debug("Unreadable request to {}: {}", request.getRequestURI(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request: " + e.getMessage(), request, null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message,
                                                         HttpServletRequest request, Map<String, Object> details) {
        ErrorResponse body = new ErrorResponse(status.value(), status.getReasonPhrase(), message,
            request.getRequestURI(), details);
        return ResponseEntity.status(status).body(body);
    }
}
