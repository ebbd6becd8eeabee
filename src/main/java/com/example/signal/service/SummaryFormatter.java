package com.example.signal.service;

import com.example.signal.model.Category;
import com.example.signal.model.FailureEvent;
import com.example.signal.model.SeverityLevel;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Renders the verdict for display. The template is fixed; tests compare it literally. */
@Component
public class SummaryFormatter {

    public String format(
            FailureEvent event,
            SeverityLevel severity,
            Category classification,
            String recommendation) {
        StringJoiner lines = new StringJoiner("\n");
        lines.add("Signal Alert: " + event.eventId());
        lines.add("Service: " + event.service());
        lines.add("Severity: " + severity.name());
        lines.add("Type: " + classification.displayName());
        lines.add("Message: " + event.message());
        lines.add("Action: " + recommendation);
        lines.add("Time: " + DateTimeFormatter.ISO_INSTANT.format(event.reportedAt()));
        if (!event.details().isEmpty()) {
            lines.add("Details: " + details(event.details()));
        }
        return lines.toString();
    }

    private static String details(Map<String, Object> details) {
        return new TreeMap<>(details)
                .entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
    }
}
