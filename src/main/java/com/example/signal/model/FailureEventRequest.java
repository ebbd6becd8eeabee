package com.example.signal.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Map;

/**
 * Shape-checked, stripped payload awaiting constraint validation. Any non-blank {@code severity}
 * is accepted; unknown levels are kept as reported.
 */
public record FailureEventRequest(
        @NotNull(message = "is required")
                @NotBlank(message = "must not be empty")
                @Size(max = 100, message = "must be at most {max} characters")
                String eventId,
        @NotNull(message = "is required") @NotBlank(message = "must not be empty")
                String timestamp,
        @NotNull(message = "is required")
                @NotBlank(message = "must not be empty")
                @Size(max = 200, message = "must be at most {max} characters")
                String service,
        @NotNull(message = "is required") @NotBlank(message = "must not be empty")
                String severity,
        @NotNull(message = "is required")
                @NotBlank(message = "must not be empty")
                @Size(max = 1000, message = "must be at most {max} characters")
                String message,
        Map<String, Object> details) {}
