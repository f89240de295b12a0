package com.deepsearch.research.controller;

import com.deepsearch.research.service.DeepSearchOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * DB와 모델 서버 상태 확인
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final DeepSearchOrchestrator orchestrator;

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return orchestrator.health()
                .map(health -> "UP".equals(health.get("status"))
                        ? ResponseEntity.ok(health)
                        : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(health));
    }
}
