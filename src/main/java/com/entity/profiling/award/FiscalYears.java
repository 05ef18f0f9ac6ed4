package com.entity.profiling.award;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the fiscal year labels found in award data.
 * Accepts "2024", "FY2024", "FY 2024", "FY24" and ISO start dates; a date in October
 * or later belongs to the next fiscal year.
 */
public final class FiscalYears {

    private static final Pattern YEAR = Pattern.compile("^(?:FY\\s*)?(\\d{4})$");
    private static final Pattern SHORT_YEAR = Pattern.compile("^FY\\s*(\\d{2})$");
    private static final Pattern DATE = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})");

    private FiscalYears() {
        // Utility class
    }

    public static OptionalInt parse(String label) {
        if (label == null || label.isBlank()) {
            return OptionalInt.empty();
        }
        String value = label.trim().toUpperCase(Locale.ROOT);

        Matcher m = YEAR.matcher(value);
        if (m.matches()) {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        }
        m = SHORT_YEAR.matcher(value);
        if (m.matches()) {
            return OptionalInt.of(2000 + Integer.parseInt(m.group(1)));
        }
        m = DATE.matcher(value);
        if (m.find()) {
            try {
                LocalDate date = LocalDate.of(Integer.parseInt(m.group(1)),
                        Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
                return OptionalInt.of(date.getMonthValue() >= 10 ? date.getYear() + 1 : date.getYear());
            } catch (DateTimeException e) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.empty();
    }
}
