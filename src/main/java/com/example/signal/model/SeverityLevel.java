package com.example.signal.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Severity derived from the event text. Declaration order is the tie-break order: the analyzer
 * checks levels from the top down and {@link #INFO} is the fallback when nothing matches.
 */
public enum SeverityLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
