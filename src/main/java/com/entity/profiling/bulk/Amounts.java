package com.entity.profiling.bulk;

import java.math.BigDecimal;

/**
 * Parses currency amounts as published ("1234.50", "$1,234.50", "(200.00)").
 */
final class Amounts {

    private Amounts() {
        // Utility class
    }

    static BigDecimal parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("missing amount");
        }
        String value = raw.trim();
        boolean negative = false;
        if (value.startsWith("(") && value.endsWith(")")) {
            negative = true;
            value = value.substring(1, value.length() - 1);
        }
        value = value.replace("$", "").replace(",", "").trim();
        try {
            BigDecimal amount = new BigDecimal(value);
            return negative ? amount.negate() : amount;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid amount '" + raw + "'");
        }
    }
}
