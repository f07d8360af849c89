package com.flamingo.ai.devicerag.api.rest;

import com.flamingo.ai.devicerag.config.RagConfig;
import com.flamingo.ai.devicerag.service.generation.RateGovernor;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and runtime info. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final RagConfig ragConfig;
  private final RateGovernor rateGovernor;
  private final Clock clock;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "UP");
    health.put("timestamp", Instant.now(clock));
    health.put("service", "device-rag");
    health.put("vectorStore", ragConfig.getVectorStore().getType());
    health.put("generationInFlight", rateGovernor.inFlight());
    return ResponseEntity.ok(health);
  }
}
