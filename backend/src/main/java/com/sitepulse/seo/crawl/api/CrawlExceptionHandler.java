package com.sitepulse.seo.crawl.api;

import com.sitepulse.seo.crawl.service.InvalidSeedUrlException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(InvalidSeedUrlException.class)
  public ResponseEntity<Map<String, String>> handleInvalidSeed(InvalidSeedUrlException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("error", "invalid_domain", "message", ex.getMessage()));
  }
}
