package com.example.signal.service;

import com.example.signal.config.AnalysisProperties;
import com.example.signal.model.FailureEvent;
import com.example.signal.model.SeverityLevel;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Recalculates severity from the event message. The caller-asserted severity is deliberately
 * not an input, so misreported events are caught.
 */
@Component
public class SeverityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SeverityAnalyzer.class);
    private final KeywordTable<SeverityLevel> table;

    public SeverityAnalyzer(AnalysisProperties properties) {
        this.table =
                KeywordTable.of(
                        SeverityLevel.class,
                        properties.severityKeywords(),
                        Set.of(SeverityLevel.INFO));
        log.info(">>> Severity keywords loaded: {}", table.keywordCounts());
    }

    public SeverityLevel calculateSeverity(FailureEvent event) {
        SeverityLevel severity = table.firstMatch(event.message()).orElse(SeverityLevel.INFO);
        if (log.isDebugEnabled()) {
            log.debug(
                    "Event {} rated {} by keyword '{}'",
                    event.eventId(),
                    severity,
                    table.decidingKeyword(event.message()).orElse("<none>"));
        }
        return severity;
    }
}
