package com.example.kvdriver.controller;

import com.example.kvdriver.driver.RemoteDriver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final RemoteDriver driver;
    private final String backend;

    public HealthController(RemoteDriver driver, @Value("${app.driver.backend:mongo}") String backend) {
        this.driver = driver;
        this.backend = backend;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("service", "kv-driver");
        health.put("version", "1.0.0");
        health.put("backend", backend);
        health.put("connected", driver.isConnected());

        // Probe the store with a lookup that is allowed to miss
        try {
            driver.getRowByKey(RemoteDriver.DEFAULT_TABLE, "health-check");
            health.put("store", "UP");
        } catch (Exception e) {
            health.put("store", "DOWN");
            health.put("storeError", e.getMessage());
        }

        boolean up = "UP".equals(health.get("store"));
        health.put("status", up ? "UP" : "DOWN");
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
