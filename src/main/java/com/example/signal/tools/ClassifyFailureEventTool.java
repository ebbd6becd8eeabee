package com.example.signal.tools;

import com.example.signal.model.AnalysisResult;
import com.example.signal.service.FailureEventValidator;
import com.example.signal.service.SignalAnalysisPipeline;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MCP tool that runs one failure event through the analysis pipeline. The request mirrors the
 * event fields one to one; validation is left to the pipeline so a bad event comes back as a
 * rejected result instead of a tool error.
 */
public class ClassifyFailureEventTool
        implements Function<ClassifyFailureEventTool.Request, AnalysisResult> {

    private static final Logger log = LoggerFactory.getLogger(ClassifyFailureEventTool.class);

    public static final String NAME = "classify_failure_event";

    private final SignalAnalysisPipeline pipeline;

    public ClassifyFailureEventTool(SignalAnalysisPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Tool input. Values stay untyped so a wrong shape reaches the validator instead of failing
     * deserialization, and keys outside the schema are collected for it to reject.
     */
    public static class Request {

        @JsonProperty("event_id")
        @JsonPropertyDescription("Unique event identifier")
        private Object eventId;

        @JsonProperty("timestamp")
        @JsonPropertyDescription("ISO-8601 time of the failure")
        private Object timestamp;

        @JsonProperty("service")
        @JsonPropertyDescription("Reporting service or component")
        private Object service;

        @JsonProperty("severity")
        @JsonPropertyDescription(
                "Severity asserted by the reporter: critical, high, medium, low or info")
        private Object severity;

        @JsonProperty("message")
        @JsonPropertyDescription("Free-text failure description")
        private Object message;

        @JsonProperty("details")
        @JsonPropertyDescription("Optional extra context as a JSON object")
        private Object details;

        @JsonIgnore private final Map<String, Object> unknownFields = new LinkedHashMap<>();

        @JsonAnySetter
        void unknownField(String key, Object value) {
            unknownFields.put(key, value);
        }

        Map<String, Object> toPayload() {
            // HashMap keeps absent fields as nulls for the validator to report
            Map<String, Object> payload = new HashMap<>(unknownFields);
            payload.put(FailureEventValidator.EVENT_ID, eventId);
            payload.put(FailureEventValidator.TIMESTAMP, timestamp);
            payload.put(FailureEventValidator.SERVICE, service);
            payload.put(FailureEventValidator.SEVERITY, severity);
            payload.put(FailureEventValidator.MESSAGE, message);
            payload.put(FailureEventValidator.DETAILS, details);
            return payload;
        }
    }

    @Override
    public AnalysisResult apply(Request request) {
        Map<String, Object> payload = request.toPayload();
        log.info(
                ">>> TOOL EXECUTION: {} for event [{}]",
                NAME,
                payload.get(FailureEventValidator.EVENT_ID));
        return pipeline.process(payload);
    }
}
