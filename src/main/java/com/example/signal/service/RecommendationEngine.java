package com.example.signal.service;

import com.example.signal.model.Category;
import com.example.signal.model.SeverityLevel;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Fixed decision table from (severity, category) to an operational response. Severity picks the
 * base action; the category may append a qualifier. Every pair has an entry.
 */
@Component
public class RecommendationEngine {

    private static final Map<SeverityLevel, String> BASE = new EnumMap<>(SeverityLevel.class);
    private static final Map<Category, String> URGENT_QUALIFIER = new EnumMap<>(Category.class);
    private static final String SECURITY_REVIEW = "Review access logs for related activity";

    static {
        BASE.put(
                SeverityLevel.CRITICAL,
                "Immediate attention required: escalate to on-call engineer");
        BASE.put(SeverityLevel.HIGH, "Prioritize investigation within the hour");
        BASE.put(SeverityLevel.MEDIUM, "Schedule investigation during business hours");
        BASE.put(SeverityLevel.LOW, "Log for trend analysis; no immediate action needed");
        BASE.put(SeverityLevel.INFO, "Log for trend analysis; no immediate action needed");

        URGENT_QUALIFIER.put(
                Category.SECURITY,
                "Rotate affected credentials and invoke the incident response process");
        URGENT_QUALIFIER.put(
                Category.DATABASE, "Check connection pool saturation and replica health");
        URGENT_QUALIFIER.put(
                Category.NETWORK, "Verify DNS resolution and upstream reachability");
        URGENT_QUALIFIER.put(
                Category.RESOURCE, "Scale capacity or free resources on the affected hosts");
        URGENT_QUALIFIER.put(
                Category.SERVICE_FAILURE, "Inspect recent deployments and consider a rollback");
    }

    public String recommend(SeverityLevel severity, Category category) {
        String base = BASE.get(severity);
        String qualifier = qualifier(severity, category);
        return qualifier == null ? base : base + ". " + qualifier;
    }

    private static String qualifier(SeverityLevel severity, Category category) {
        boolean urgent = severity == SeverityLevel.CRITICAL || severity == SeverityLevel.HIGH;
        if (urgent) {
            return URGENT_QUALIFIER.get(category);
        }
        // Security events are never only logged
        return category == Category.SECURITY ? SECURITY_REVIEW : null;
    }
}
