package com.prospectpulse.backend.controller;

import com.prospectpulse.backend.store.StoreClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/health")
@Tag(name = "Health")
public class HealthController {

    private final StoreClient storeClient;

    public HealthController(StoreClient storeClient) {
        this.storeClient = storeClient;
    }

    @GetMapping
    @Operation(summary = "Service health", description = "DEGRADED when the shared store is unreachable or replaced by the in-memory fallback")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> store = storeClient.describe();
        boolean healthy = Boolean.TRUE.equals(store.get("reachable")) && "redis".equals(store.get("backend"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthy ? "UP" : "DEGRADED");
        body.put("service", "prospectpulse-backend");
        body.put("store", store);
        return ResponseEntity.ok(body);
    }
}
