package com.example.signal.service;

import com.example.signal.model.AnalysisResult;
import com.example.signal.model.Category;
import com.example.signal.model.FailureEvent;
import com.example.signal.model.SeverityLevel;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one payload through validation, severity, classification, recommendation and summary.
 * Holds no per-call state; concurrent calls are independent.
 *
 * <p>A payload that fails validation yields a rejected result carrying the reason. Anything
 * that goes wrong after validation is an internal fault and surfaces as a {@link
 * SignalAnalysisException}.
 */
@Service
public class SignalAnalysisPipeline {

    private static final Logger log = LoggerFactory.getLogger(SignalAnalysisPipeline.class);

    private final FailureEventValidator validator;
    private final SeverityAnalyzer severityAnalyzer;
    private final EventClassifier classifier;
    private final RecommendationEngine recommendationEngine;
    private final SummaryFormatter summaryFormatter;

    public SignalAnalysisPipeline(
            FailureEventValidator validator,
            SeverityAnalyzer severityAnalyzer,
            EventClassifier classifier,
            RecommendationEngine recommendationEngine,
            SummaryFormatter summaryFormatter) {
        this.validator = validator;
        this.severityAnalyzer = severityAnalyzer;
        this.classifier = classifier;
        this.recommendationEngine = recommendationEngine;
        this.summaryFormatter = summaryFormatter;
    }

    public AnalysisResult process(Map<String, ?> payload) {
        FailureEvent event;
        try {
            event = validator.validate(payload);
        } catch (EventValidationException e) {
            log.warn(">>> Event rejected: {}", e.getMessage());
            return AnalysisResult.rejected(
                    echo(payload, FailureEventValidator.EVENT_ID),
                    echo(payload, FailureEventValidator.SEVERITY),
                    e.getMessage());
        }

        log.info(">>> Processing event: {} ({})", event.eventId(), event.service());
        try {
            AnalysisResult result = analyze(event);
            log.info(
                    ">>> Analysis complete: {} -> {} ({})",
                    event.eventId(),
                    result.classification().wireName(),
                    result.calculatedSeverity().wireName());
            return result;
        } catch (RuntimeException e) {
            log.error(">>> Analysis failed for event {}", event.eventId(), e);
            throw new SignalAnalysisException(
                    "Analysis failed for event " + event.eventId(), e);
        }
    }

    private AnalysisResult analyze(FailureEvent event) {
        SeverityLevel severity = severityAnalyzer.calculateSeverity(event);
        Category category = classifier.classify(event);
        String recommendation = recommendationEngine.recommend(severity, category);
        String summary = summaryFormatter.format(event, severity, category, recommendation);
        return AnalysisResult.processed(event, severity, category, recommendation, summary);
    }

    private static String echo(Map<String, ?> payload, String field) {
        if (payload == null) {
            return null;
        }
        Object value = payload.get(field);
        return value instanceof String text ? text.strip() : null;
    }
}
