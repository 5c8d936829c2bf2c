package com.delta.autoapply.run.api;

import com.delta.autoapply.run.service.RunNotFoundException;
import com.delta.autoapply.run.service.RunUnavailableException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RunExceptionHandler {

  @ExceptionHandler(RunNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleRunNotFound(RunNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "run_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(RunUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleUnavailable(RunUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "run_unavailable", "message", ex.getMessage()));
  }
}
