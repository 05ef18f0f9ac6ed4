package com.entity.profiling.matching;

import java.util.List;
import java.util.Locale;

/**
 * Recognizes recipients that are inter-organization bodies (consortia, councils,
 * associations) rather than a single canonical entity. Their awards are reported
 * as unattributed instead of being credited to whichever member scores highest.
 */
public class ConsortiumDetector {

    public static final List<String> DEFAULT_PATTERNS = List.of(
            "inter tribal", "intertribal", "inter-tribal",
            "consortium", "council of", "united tribes",
            "indian health board", "tribal council inc",
            "association of", "united south and eastern"
    );

    private final List<String> patterns;

    public ConsortiumDetector() {
        this(DEFAULT_PATTERNS);
    }

    public ConsortiumDetector(List<String> patterns) {
        this.patterns = patterns.stream().map(p -> p.toLowerCase(Locale.ROOT)).toList();
    }

    public boolean isConsortium(String recipientName) {
        if (recipientName == null) {
            return false;
        }
        String lowered = recipientName.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (lowered.contains(pattern)) {
                return true;
            }
        }
        return false;
    }
}
