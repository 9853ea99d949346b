package com.cred.freestyle.deadpool.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every endpoint. Conflict responses carry a machine-readable
 * {@code details.reason}; store outages carry {@code details.retryable}.
 *
 * @author Deadpool Team
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {

    private Instant timestamp = Instant.now();
    private int status;
    private String error;
    private String message;
    private String path;
    private Map<String, Object> details = new LinkedHashMap<>();

    public ErrorResponse(int status, String error, String message, String path) {
        this.status = status;
        this.error = error;
        this.message = message;
        this.path = path;
    }

    public ErrorResponse addDetail(String key, Object value) {
        details.put(key, value);
        return this;
    }
}
