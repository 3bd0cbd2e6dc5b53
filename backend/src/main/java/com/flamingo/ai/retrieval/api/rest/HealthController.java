package com.flamingo.ai.retrieval.api.rest;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.service.cache.ResponseCache;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Liveness plus the settings that decide how retrieval behaves. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final ResponseCache responseCache;
  private final RagConfig ragConfig;

  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "UP");
    body.put("service", "retrieval");
    body.put("cachedResponses", responseCache.stats().size());
    body.put("embeddingDimension", ragConfig.getEmbedding().getDimension());
    body.put("rerankerEnabled", ragConfig.getReranking().isEnabled());
    body.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(body);
  }
}
