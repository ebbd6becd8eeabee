package com.example.signal.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Verdict for one event. Field names on the wire are snake_case and are matched literally by
 * downstream tooling.
 */
@JsonPropertyOrder({
    "event_id",
    "original_severity",
    "calculated_severity",
    "classification",
    "recommendation",
    "processed_at",
    "human_readable",
    "status",
    "reason"
})
public record AnalysisResult(
        @JsonProperty("event_id") String eventId,
        @JsonProperty("original_severity") String originalSeverity,
        @JsonProperty("calculated_severity") SeverityLevel calculatedSeverity,
        @JsonProperty("classification") Category classification,
        @JsonProperty("recommendation") String recommendation,
        @JsonProperty("processed_at") String processedAt,
        @JsonProperty("human_readable") String humanReadable,
        @JsonProperty("status") AnalysisStatus status,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("reason") String reason) {

    public static AnalysisResult processed(
            FailureEvent event,
            SeverityLevel calculatedSeverity,
            Category classification,
            String recommendation,
            String humanReadable) {
        return new AnalysisResult(
                event.eventId(),
                event.severity(),
                calculatedSeverity,
                classification,
                recommendation,
                event.timestamp(),
                humanReadable,
                AnalysisStatus.PROCESSED,
                null);
    }

    /** Calculated fields stay null; only what the caller sent is echoed back. */
    public static AnalysisResult rejected(String eventId, String originalSeverity, String reason) {
        return new AnalysisResult(
                eventId,
                originalSeverity,
                null,
                null,
                null,
                null,
                null,
                AnalysisStatus.REJECTED,
                reason);
    }

    @JsonIgnore
    public boolean isProcessed() {
        return status == AnalysisStatus.PROCESSED;
    }
}
