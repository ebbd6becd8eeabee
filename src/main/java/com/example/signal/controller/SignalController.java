package com.example.signal.controller;

import com.example.signal.model.AnalysisResult;
import com.example.signal.service.SignalAnalysisPipeline;
import com.example.signal.tools.HealthCheckTool;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** HTTP intake for failure events, next to the MCP tools. */
@RestController
@RequestMapping("/api")
public class SignalController {

    private final SignalAnalysisPipeline pipeline;
    private final HealthCheckTool healthCheck = new HealthCheckTool();

    public SignalController(SignalAnalysisPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping("/events")
    public ResponseEntity<AnalysisResult> processEvent(@RequestBody Map<String, Object> event) {
        AnalysisResult result = pipeline.process(event);
        HttpStatus status = result.isProcessed() ? HttpStatus.OK : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/health")
    public HealthCheckTool.Response health() {
        return healthCheck.apply(new HealthCheckTool.Request());
    }
}
