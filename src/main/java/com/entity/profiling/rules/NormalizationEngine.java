package com.entity.profiling.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies normalization rules to names before alias lookup and fuzzy scoring.
 * Rules run in priority order; the result is always case-folded, trimmed and
 * whitespace-collapsed. The rule list is fixed at construction so one engine can be
 * shared read-only across a run.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Gets all rules in application order.
     */
    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes the given name. Returns an empty string for null or blank input.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name.trim();
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result).trim();
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    /**
     * Checks if two names are equivalent after normalization.
     */
    public boolean areEquivalent(String name1, String name2) {
        return normalize(name1).equals(normalize(name2));
    }
}
