package com.example.kvdriver.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    private final String backend;

    public CapabilitiesTools(@Value("${app.driver.backend:mongo}") String backend) {
        this.backend = backend;
    }

    @Tool(description = "Describe this server, its storage backend and the tools it offers")
    public Map<String, Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", "kv-driver", "version", "1.0.0"),
                "backend", backend,
                "tools", List.of("kv_get", "kv_set", "kv_del", "kv_scan", "kv_list", "kv_clear")
        );
    }
}
