package com.modelregistry.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Service and database health")
public class HealthController {

    static final String SERVICE_NAME = "model-registry-api";

    private final MongoTemplate mongoTemplate;

    @GetMapping("/health")
    @Operation(summary = "Service liveness")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "service", SERVICE_NAME,
                "timestamp", Instant.now().toString()));
    }

    @GetMapping("/health/database")
    @Operation(summary = "Ping the registry's MongoDB deployment")
    public ResponseEntity<Map<String, Object>> databaseHealth() {
        Map<String, Object> health = new HashMap<>();
        try {
            mongoTemplate.getDb().runCommand(new Document("ping", 1));
            health.put("status", "UP");
            health.put("message", "Connection successful");
            health.put("database", mongoTemplate.getDb().getName());
        } catch (Exception e) {
            log.warn("MongoDB health check failed: {}", e.getMessage());
            health.put("status", "DOWN");
            health.put("message", e.getMessage());
        }
        return ResponseEntity.ok(health);
    }
}
