package com.example.signal.service;

/** A payload that cannot become a {@link com.example.signal.model.FailureEvent}. */
public class EventValidationException extends Exception {

    private final String field;
    private final String reason;

    public EventValidationException(String field, String reason) {
        super("Invalid field '" + field + "': " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
