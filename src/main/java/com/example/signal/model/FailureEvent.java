package com.example.signal.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A validated failure event. Instances only come out of the validator, so every string field is
 * non-blank and {@code reportedAt} is always set.
 *
 * @param eventId Caller-assigned opaque identifier.
 * @param timestamp Raw timestamp as reported.
 * @param reportedAt Parsed form of {@code timestamp}, used for display only.
 * @param service Name of the reporting service or component.
 * @param severity Caller-asserted severity. Never used to derive the calculated severity.
 * @param message Free-text failure description.
 * @param details Uninterpreted context, copied defensively.
 */
public record FailureEvent(
        String eventId,
        String timestamp,
        Instant reportedAt,
        String service,
        String severity,
        String message,
        Map<String, Object> details) {

    public FailureEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(reportedAt, "reportedAt");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(message, "message");
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
