package com.flamingo.ai.retrieval.api.rest;

import com.flamingo.ai.retrieval.service.cache.CacheStats;
import com.flamingo.ai.retrieval.service.cache.ResponseCache;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for response cache administration. */
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

  private final ResponseCache responseCache;

  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    CacheStats stats = responseCache.stats();
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("size", stats.size());
    body.put("max_size", stats.maxSize());
    body.put("ttl_hours", stats.ttlHours());
    return ResponseEntity.ok(body);
  }

  @DeleteMapping
  public ResponseEntity<Void> clear() {
    responseCache.clear();
    return ResponseEntity.noContent().build();
  }
}
