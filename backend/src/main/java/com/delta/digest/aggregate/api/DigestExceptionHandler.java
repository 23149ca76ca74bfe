package com.delta.digest.aggregate.api;

import com.delta.digest.aggregate.service.InvalidSourceConfigException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class DigestExceptionHandler {

  @ExceptionHandler(InvalidSourceConfigException.class)
  public ResponseEntity<Map<String, String>> handleInvalidSource(InvalidSourceConfigException ex) {
    String source = ex.getSourceKey() == null ? "" : ex.getSourceKey();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "config_invalid", "source", source, "message", ex.getMessage()));
  }
}
