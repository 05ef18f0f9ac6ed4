package com.entity.profiling.matching;

import com.entity.profiling.geo.StateCodes;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Determines the state a recipient is located in, used for secondary validation of
 * fuzzy matches.
 */
public final class RecipientStates {

    private static final Pattern TRAILING_STATE = Pattern.compile(",\\s*([A-Z]{2})\\s*$");

    private RecipientStates() {
        // Utility class
    }

    /**
     * Returns the declared state when it is a valid code, otherwise the state qualifier
     * extracted from the name, otherwise null.
     */
    public static String resolve(String declaredState, String recipientName) {
        if (declaredState != null && StateCodes.isValid(declaredState)) {
            return declaredState.trim().toUpperCase(Locale.ROOT);
        }
        return extractFromName(recipientName);
    }

    /**
     * Extracts a trailing ", XX" state qualifier ("HOPI TRIBE, AZ" gives "AZ").
     * Returns null when absent or not a US state or territory.
     */
    public static String extractFromName(String recipientName) {
        if (recipientName == null) {
            return null;
        }
        Matcher m = TRAILING_STATE.matcher(recipientName.trim());
        if (m.find() && StateCodes.isValid(m.group(1))) {
            return m.group(1);
        }
        return null;
    }
}
