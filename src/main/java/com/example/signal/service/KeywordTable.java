package com.example.signal.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered list of (key, keyword set) rules evaluated first-match-wins. Rule order follows the
 * declaration order of the key enum. Keywords match case-insensitively from the start of a word,
 * so "outage" hits "outages" and "down" hits "service down" but not "shutdown". A numeric keyword
 * does not match inside a longer number: "500" misses "5000ms".
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class KeywordTable<K extends Enum<K>> {

    private final List<Rule<K>> rules;

    private KeywordTable(List<Rule<K>> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Compiles a table. Every constant of {@code type} except the ones in {@code fallbacks} must
     * have at least one non-blank keyword.
     *
     * @throws SignalAnalysisException if a required key has no keywords
     */
    public static <K extends Enum<K>> KeywordTable<K> of(
            Class<K> type, Map<K, ? extends Collection<String>> keywords, Collection<K> fallbacks) {
        Map<K, ? extends Collection<String>> source = keywords == null ? Map.of() : keywords;
        Map<K, List<String>> normalized = new EnumMap<>(type);
        source.forEach((key, words) -> normalized.put(key, normalize(words)));

        List<Rule<K>> rules = new ArrayList<>();
        for (K key : type.getEnumConstants()) {
            List<String> words = normalized.getOrDefault(key, List.of());
            if (fallbacks.contains(key)) {
                if (!words.isEmpty()) {
                    throw new SignalAnalysisException(
                            "Keyword table for "
                                    + type.getSimpleName()
                                    + " must not define keywords for fallback '"
                                    + key
                                    + "'");
                }
                continue;
            }
            if (words.isEmpty()) {
                throw new SignalAnalysisException(
                        "Keyword table for "
                                + type.getSimpleName()
                                + " has no keywords for '"
                                + key
                                + "'");
            }
            rules.add(new Rule<>(key, words, compile(words)));
        }
        return new KeywordTable<>(rules);
    }

    /** First rule, in priority order, whose keywords occur in {@code text}. */
    public Optional<K> firstMatch(String text) {
        return firstMatchingRule(text).map(Rule::key);
    }

    /** The keyword that decided {@link #firstMatch}, for diagnostics. */
    public Optional<String> decidingKeyword(String text) {
        return firstMatchingRule(text)
                .flatMap(
                        rule -> {
                            var matcher = rule.pattern().matcher(text);
                            return matcher.find()
                                    ? Optional.of(matcher.group(1).toLowerCase(Locale.ROOT))
                                    : Optional.empty();
                        });
    }

    public List<K> priorityOrder() {
        return rules.stream().map(Rule::key).collect(Collectors.toUnmodifiableList());
    }

    public List<String> keywords(K key) {
        return rules.stream()
                .filter(rule -> rule.key() == key)
                .findFirst()
                .map(Rule::keywords)
                .orElse(List.of());
    }

    /** Keyword count per key in priority order, for the startup log. */
    public Map<K, Integer> keywordCounts() {
        Map<K, Integer> counts = new LinkedHashMap<>();
        rules.forEach(rule -> counts.put(rule.key(), rule.keywords().size()));
        return counts;
    }

    private Optional<Rule<K>> firstMatchingRule(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Rule<K> rule : rules) {
            if (rule.pattern().matcher(text).find()) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    private static List<String> normalize(Collection<String> words) {
        if (words == null) {
            return List.of();
        }
        return words.stream()
                .filter(word -> word != null && !word.isBlank())
                .map(word -> word.strip().toLowerCase(Locale.ROOT))
                .distinct()
                .collect(Collectors.toUnmodifiableList());
    }

    private static Pattern compile(List<String> words) {
        // Longest first so "out of memory" wins over "memory" in decidingKeyword
        String alternation =
                words.stream()
                        .sorted((a, b) -> Integer.compare(b.length(), a.length()))
                        .map(Pattern::quote)
                        .collect(Collectors.joining("|"));
        return Pattern.compile(
                "(?<![\\p{L}\\p{N}])(" + alternation + ")(?!\\p{N})",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private record Rule<K>(K key, List<String> keywords, Pattern pattern) {}
}
