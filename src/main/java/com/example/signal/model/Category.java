package com.example.signal.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Operational category of a failure event. Declaration order is the classification priority:
 * security and data problems must never be masked by a generic network or resource match.
 */
public enum Category {
    SECURITY,
    DATABASE,
    NETWORK,
    RESOURCE,
    SERVICE_FAILURE,
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** "service_failure" -> "Service Failure". */
    public String displayName() {
        return Arrays.stream(name().split("_"))
                .map(word -> word.charAt(0) + word.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}
