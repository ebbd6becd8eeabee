package com.example.signal.config;

import com.example.signal.model.Category;
import com.example.signal.model.SeverityLevel;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Keyword tables for the analysis pipeline, bound once at startup from {@code signal.analysis}.
 * Map order is irrelevant: priority comes from the enum declaration order. Empty tables, empty
 * keyword lists and blank keywords fail binding; a missing non-fallback key is caught when the
 * table is compiled.
 *
 * @param severityKeywords Keywords per severity level. {@code info} is the fallback and has none.
 * @param categoryKeywords Keywords per category. {@code unknown} is the fallback and has none.
 */
@Validated
@ConfigurationProperties(prefix = "signal.analysis")
public record AnalysisProperties(
        @NotEmpty Map<SeverityLevel, @NotEmpty List<@NotBlank String>> severityKeywords,
        @NotEmpty Map<Category, @NotEmpty List<@NotBlank String>> categoryKeywords) {

    public AnalysisProperties {
        severityKeywords = severityKeywords == null ? Map.of() : Map.copyOf(severityKeywords);
        categoryKeywords = categoryKeywords == null ? Map.of() : Map.copyOf(categoryKeywords);
    }
}
