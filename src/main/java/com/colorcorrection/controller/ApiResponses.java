package com.colorcorrection.controller;

import com.colorcorrection.exception.AdmissionConflictException;
import com.colorcorrection.exception.BatchValidationException;
import com.colorcorrection.exception.PipelineUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error bodies shared by the controllers: {@code {"success": false, "error": "..."}}.
 */
@Slf4j
final class ApiResponses {

    private ApiResponses() {}

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Maps the service exceptions to their status; anything else is a 500.
     */
    static ResponseEntity<Map<String, Object>> fromException(String operation, Exception e) {
        if (e instanceof AdmissionConflictException conflict) {
            log.warn("{} rejected: {} (active batch {})", operation, e.getMessage(), conflict.getActiveBatchId());
            ResponseEntity<Map<String, Object>> response = error(HttpStatus.CONFLICT, e.getMessage());
            response.getBody().put("batch_id", conflict.getActiveBatchId());
            return response;
        }
        if (e instanceof BatchValidationException) {
            log.warn("{} rejected: {}", operation, e.getMessage());
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        if (e instanceof PipelineUnavailableException) {
            log.warn("{} unavailable: {}", operation, e.getMessage());
            return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
        }
        log.error("{} error: {}", operation, e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    static Map<String, Object> success() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        return body;
    }
}
