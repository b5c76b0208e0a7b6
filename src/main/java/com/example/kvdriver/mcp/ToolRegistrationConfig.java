package com.example.kvdriver.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    private final DriverTools driverTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(DriverTools driverTools, CapabilitiesTools capTools) {
        this.driverTools = driverTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(driverTools, capTools)
                .build();
    }
}
