package com.example.signal.config;

import com.example.signal.service.SignalAnalysisPipeline;
import com.example.signal.tools.ClassifyFailureEventTool;
import com.example.signal.tools.HealthCheckTool;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.function.FunctionToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Tools exposed by the MCP server. Every {@link ToolCallback} bean is registered. */
@Configuration
public class ToolsConfig {

    @Bean
    public ToolCallback classifyFailureEvent(SignalAnalysisPipeline pipeline) {
        return FunctionToolCallback.builder(
                        ClassifyFailureEventTool.NAME, new ClassifyFailureEventTool(pipeline))
                .description(
                        "Analyze and classify a failure event: recalculates severity from the"
                                + " message, assigns a category and recommends a response")
                .inputType(ClassifyFailureEventTool.Request.class)
                .build();
    }

    @Bean
    public ToolCallback healthCheck() {
        return FunctionToolCallback.builder(HealthCheckTool.NAME, new HealthCheckTool())
                .description("Server health and status verification")
                .inputType(HealthCheckTool.Request.class)
                .build();
    }
}
