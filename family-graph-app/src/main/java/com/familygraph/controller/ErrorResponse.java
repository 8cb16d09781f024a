package com.familygraph.controller;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Body of every error returned by the API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    int status,
    String error,
    String message,
    String path,
    Instant timestamp,
    Map<String, Object> details
) {
    public ErrorResponse(int status, String error, String message, String path, Map<String, Object> details) {
        this(status, error, message, path, Instant.now(), details);
    }
}
