package com.example.signal.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AnalysisStatus {
    PROCESSED,
    REJECTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
