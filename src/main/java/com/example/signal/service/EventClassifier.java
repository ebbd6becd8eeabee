package com.example.signal.service;

import com.example.signal.config.AnalysisProperties;
import com.example.signal.model.Category;
import com.example.signal.model.FailureEvent;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Assigns exactly one {@link Category}. The message decides; the service name is consulted only
 * when the message matches nothing, so "orders-db" still lands in database.
 */
@Component
public class EventClassifier {

    private static final Logger log = LoggerFactory.getLogger(EventClassifier.class);
    private final KeywordTable<Category> table;

    public EventClassifier(AnalysisProperties properties) {
        this.table =
                KeywordTable.of(
                        Category.class, properties.categoryKeywords(), Set.of(Category.UNKNOWN));
        log.info(">>> Category keywords loaded: {}", table.keywordCounts());
    }

    public Category classify(FailureEvent event) {
        Category category =
                table.firstMatch(event.message())
                        .or(() -> table.firstMatch(event.service()))
                        .orElse(Category.UNKNOWN);
        if (log.isDebugEnabled()) {
            log.debug(
                    "Event {} classified {} by keyword '{}'",
                    event.eventId(),
                    category,
                    table.decidingKeyword(event.message())
                            .or(() -> table.decidingKeyword(event.service()))
                            .orElse("<none>"));
        }
        return category;
    }
}
