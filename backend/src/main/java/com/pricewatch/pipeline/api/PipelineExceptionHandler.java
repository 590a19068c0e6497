package com.pricewatch.pipeline.api;

import com.pricewatch.pipeline.retention.MissingRetentionPolicyException;
import com.pricewatch.pipeline.service.ActiveJobRunException;
import com.pricewatch.pipeline.service.InvalidJobConfigurationException;
import com.pricewatch.pipeline.service.JobNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class PipelineExceptionHandler {

    @ExceptionHandler(ActiveJobRunException.class)
    public ResponseEntity<Map<String, String>> handleActiveRun(ActiveJobRunException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "active_job_run", "message", ex.getMessage()));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(JobNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
    }

    @ExceptionHandler(InvalidJobConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleInvalid(InvalidJobConfigurationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_job_configuration", "message", ex.getMessage()));
    }

    @ExceptionHandler(MissingRetentionPolicyException.class)
    public ResponseEntity<Map<String, String>> handleMissingPolicy(MissingRetentionPolicyException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(Map.of("error", "missing_retention_policy", "message", ex.getMessage()));
    }
}
