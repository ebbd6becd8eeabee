package com.example.signal.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.signal.model.FailureEvent;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class FailureEventValidatorTest {

    private final FailureEventValidator validator = new FailureEventValidator();

    private static Map<String, Object> validPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("event_id", "sig_001");
        payload.put("timestamp", "2025-06-08T10:30:00Z");
        payload.put("service", "auth-svc");
        payload.put("severity", "critical");
        payload.put("message", "PostgreSQL connection pool exhausted");
        payload.put("details", Map.of("pool_size", 20));
        return payload;
    }

    @Test
    void acceptsCompletePayload() throws EventValidationException {
        FailureEvent event = validator.validate(validPayload());

        assertEquals("sig_001", event.eventId());
        assertEquals("auth-svc", event.service());
        assertEquals("critical", event.severity());
        assertEquals(Instant.parse("2025-06-08T10:30:00Z"), event.reportedAt());
        assertEquals(Map.of("pool_size", 20), event.details());
    }

    @Test
    void stripsWhitespaceFromStrings() throws EventValidationException {
        Map<String, Object> payload = validPayload();
        payload.put("service", "  auth-svc \n");

        assertEquals("auth-svc", validator.validate(payload).service());
    }

    @Test
    void missingMessageIsRejected() {
        Map<String, Object> payload = validPayload();
        payload.remove("message");

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals("message", e.getField());
        assertEquals("is required", e.getReason());
    }

    @Test
    void blankRequiredFieldIsRejected() {
        Map<String, Object> payload = validPayload();
        payload.put("event_id", "   ");

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals("event_id", e.getField());
        assertEquals("Invalid field 'event_id': must not be empty", e.getMessage());
    }

    @Test
    void wrongShapeIsRejected() {
        Map<String, Object> payload = validPayload();
        payload.put("service", 42);

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals("service", e.getField());
        assertEquals("must be a string but was Integer", e.getReason());
    }

    @Test
    void detailsMustBeAnObject() {
        Map<String, Object> payload = validPayload();
        payload.put("details", "pool_size=20");

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals("details", e.getField());
        assertEquals("must be an object but was String", e.getReason());
    }

    @Test
    void overlongIdentifierIsRejected() {
        Map<String, Object> payload = validPayload();
        payload.put("event_id", "x".repeat(101));

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals("event_id", e.getField());
        assertEquals("must be at most 100 characters", e.getReason());
    }

    @Test
    void lengthLimitAppliesAfterStripping() throws EventValidationException {
        Map<String, Object> payload = validPayload();
        payload.put("message", " " + "m".repeat(1000) + " ");

        assertEquals(1000, validator.validate(payload).message().length());
    }

    @Test
    void overlongMessageIsRejected() {
        Map<String, Object> payload = validPayload();
        payload.put("message", "m".repeat(1001));

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals("message", e.getField());
        assertEquals("must be at most 1000 characters", e.getReason());
    }

    @Test
    void unparseableTimestampIsRejected() {
        Map<String, Object> payload = validPayload();
        payload.put("timestamp", "yesterday afternoon");

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals("timestamp", e.getField());
        assertEquals(
                "must be an ISO-8601 date-time but was 'yesterday afternoon'", e.getReason());
    }

    @Test
    void localTimestampIsReadAsUtc() throws EventValidationException {
        Map<String, Object> payload = validPayload();
        payload.put("timestamp", "2025-06-08T10:30:00");

        assertEquals(
                Instant.parse("2025-06-08T10:30:00Z"), validator.validate(payload).reportedAt());
    }

    @Test
    void detailsMayBeAbsent() throws EventValidationException {
        Map<String, Object> payload = validPayload();
        payload.remove("details");

        assertTrue(validator.validate(payload).details().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"timestamp", "severity"})
    void timestampAndSeverityAreRequired(String field) {
        Map<String, Object> payload = validPayload();
        payload.remove(field);

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals(field, e.getField());
        assertEquals("is required", e.getReason());
    }

    @Test
    void blankSeverityIsRejected() {
        Map<String, Object> payload = validPayload();
        payload.put("severity", "  ");

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals("severity", e.getField());
        assertEquals("must not be empty", e.getReason());
    }

    @Test
    void firstFailingFieldIsReported() {
        Map<String, Object> payload = validPayload();
        payload.remove("message");
        payload.put("service", "");
        payload.put("event_id", "x".repeat(101));

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals("event_id", e.getField());
    }

    @Test
    void unknownKeyIsRejected() {
        Map<String, Object> payload = validPayload();
        payload.remove("details");
        payload.put("detials", Map.of("pool_size", 20));

        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(payload));
        assertEquals("detials", e.getField());
        assertEquals("is not a recognized field", e.getReason());
    }

    @Test
    void nullDetailValuesAreDropped() throws EventValidationException {
        Map<String, Object> details = new HashMap<>();
        details.put("pool_size", 20);
        details.put("region", null);
        Map<String, Object> payload = validPayload();
        payload.put("details", details);

        assertEquals(Map.of("pool_size", 20), validator.validate(payload).details());
    }

    @Test
    void unknownSeverityIsKeptAsIs() throws EventValidationException {
        Map<String, Object> payload = validPayload();
        payload.put("severity", "catastrophic");

        assertEquals("catastrophic", validator.validate(payload).severity());
    }

    @Test
    void nullPayloadIsRejected() {
        EventValidationException e =
                assertThrows(EventValidationException.class, () -> validator.validate(null));
        assertEquals("payload", e.getField());
    }
}
