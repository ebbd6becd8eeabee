package com.example.signal.service;

import com.example.signal.model.FailureEvent;
import com.example.signal.model.FailureEventRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns an already-decoded payload into a {@link FailureEvent}. Unknown keys and wrongly-typed
 * values are rejected first; the stripped strings are then checked against the constraints
 * declared on {@link FailureEventRequest}. A bad payload is rejected as a whole, never partially
 * accepted, and always on the first failing field in {@link #FIELDS} order.
 */
@Component
public class FailureEventValidator {

    public static final String EVENT_ID = "event_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String SERVICE = "service";
    public static final String SEVERITY = "severity";
    public static final String MESSAGE = "message";
    public static final String DETAILS = "details";

    static final List<String> FIELDS =
            List.of(EVENT_ID, TIMESTAMP, SERVICE, SEVERITY, MESSAGE, DETAILS);

    private static final Map<String, String> WIRE_NAMES =
            Map.of(
                    "eventId", EVENT_ID,
                    "timestamp", TIMESTAMP,
                    "service", SERVICE,
                    "severity", SEVERITY,
                    "message", MESSAGE,
                    "details", DETAILS);

    // Field order first, then "is required" ahead of the other constraints on a null value
    private static final Comparator<ConstraintViolation<FailureEventRequest>> VIOLATION_ORDER =
            Comparator.<ConstraintViolation<FailureEventRequest>>comparingInt(
                            violation -> FIELDS.indexOf(wireName(violation)))
                    .thenComparingInt(
                            violation ->
                                    violation.getConstraintDescriptor().getAnnotation()
                                                    instanceof NotNull
                                            ? 0
                                            : 1)
                    .thenComparing(ConstraintViolation::getMessage);

    private final Validator validator;

    @Autowired
    public FailureEventValidator(Validator validator) {
        this.validator = validator;
    }

    /** Standalone instance backed by the default Bean Validation provider. */
    public FailureEventValidator() {
        this(Validation.buildDefaultValidatorFactory().getValidator());
    }

    public FailureEvent validate(Map<String, ?> payload) throws EventValidationException {
        if (payload == null) {
            throw new EventValidationException("payload", "is missing");
        }
        rejectUnknownKeys(payload);

        FailureEventRequest request =
                new FailureEventRequest(
                        string(payload, EVENT_ID),
                        string(payload, TIMESTAMP),
                        string(payload, SERVICE),
                        string(payload, SEVERITY),
                        string(payload, MESSAGE),
                        details(payload));

        Optional<ConstraintViolation<FailureEventRequest>> violation =
                validator.validate(request).stream().min(VIOLATION_ORDER);
        if (violation.isPresent()) {
            throw new EventValidationException(
                    wireName(violation.get()), violation.get().getMessage());
        }

        return new FailureEvent(
                request.eventId(),
                request.timestamp(),
                parseTimestamp(request.timestamp()),
                request.service(),
                request.severity(),
                request.message(),
                request.details());
    }

    private static void rejectUnknownKeys(Map<String, ?> payload) throws EventValidationException {
        for (String key : new TreeSet<>(payload.keySet())) {
            if (!FIELDS.contains(key)) {
                throw new EventValidationException(key, "is not a recognized field");
            }
        }
    }

    private static String string(Map<String, ?> payload, String field)
            throws EventValidationException {
        Object raw = payload.get(field);
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof String text)) {
            throw new EventValidationException(
                    field, "must be a string but was " + raw.getClass().getSimpleName());
        }
        return text.strip();
    }

    private static Instant parseTimestamp(String timestamp) throws EventValidationException {
        try {
            return OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException withoutOffset) {
            // Local date-times are read as UTC
            try {
                return LocalDateTime.parse(timestamp).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                throw new EventValidationException(
                        TIMESTAMP, "must be an ISO-8601 date-time but was '" + timestamp + "'");
            }
        }
    }

    private static Map<String, Object> details(Map<String, ?> payload)
            throws EventValidationException {
        Object raw = payload.get(DETAILS);
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map<?, ?> map)) {
            throw new EventValidationException(
                    DETAILS, "must be an object but was " + raw.getClass().getSimpleName());
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            // Map.copyOf downstream rejects null values
            if (entry.getValue() != null) {
                copy.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return copy;
    }

    private static String wireName(ConstraintViolation<?> violation) {
        String property = violation.getPropertyPath().toString();
        return WIRE_NAMES.getOrDefault(property, property);
    }
}
