package com.example.signal;

import com.example.signal.model.AnalysisResult;
import com.example.signal.service.SignalAnalysisPipeline;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Pushes sample events through the pipeline at startup when {@code signal.demo.enabled=true}. */
@Configuration
@ConditionalOnProperty(prefix = "signal.demo", name = "enabled", havingValue = "true")
public class Runner {

    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    static final List<Map<String, Object>> SAMPLE_EVENTS =
            List.of(
                    Map.of(
                            "event_id", "sig_001",
                            "timestamp", "2025-06-08T10:30:00Z",
                            "service", "auth-svc",
                            "severity", "critical",
                            "message",
                                    "PostgreSQL connection pool exhausted - unable to serve"
                                            + " authentication requests",
                            "details", Map.of("pool_size", 20, "active_connections", 20)),
                    Map.of(
                            "event_id", "sig_002",
                            "timestamp", "2025-06-08T10:31:00Z",
                            "service", "edge-proxy",
                            "severity", "low",
                            "message", "DNS lookup timeout, retrying"));

    @Bean
    ApplicationRunner runDemo(SignalAnalysisPipeline pipeline) {
        return args -> {
            for (Map<String, Object> event : SAMPLE_EVENTS) {
                AnalysisResult result = pipeline.process(event);
                log.info(
                        "\n>>> DEMO RESULT [{}]:\n{}",
                        result.status().wireName(),
                        result.humanReadable());
            }
        };
    }
}
