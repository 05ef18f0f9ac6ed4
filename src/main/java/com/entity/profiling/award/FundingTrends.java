package com.entity.profiling.award;

import com.entity.profiling.core.model.FundingTrend;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Classifies the direction of an entity's funding over a fiscal year range.
 *
 * <p>Ranges of one or two years compare the last year against the first. Longer ranges
 * report NEW when nothing was obligated before the final two years, otherwise compare
 * the second half of the range against the first half: more than 20% up is INCREASING,
 * more than 20% down is DECREASING.</p>
 */
public final class FundingTrends {

    private static final BigDecimal GROWTH = new BigDecimal("1.2");
    private static final BigDecimal DECLINE = new BigDecimal("0.8");

    private FundingTrends() {
        // Utility class
    }

    public static FundingTrend compute(Map<Integer, BigDecimal> yearlyObligations, FiscalYearRange range) {
        List<Integer> years = range.years();
        BigDecimal total = sum(yearlyObligations, years);
        if (total.signum() == 0) {
            return FundingTrend.NONE;
        }

        if (years.size() <= 2) {
            if (years.size() == 1) {
                return FundingTrend.NEW;
            }
            BigDecimal first = yearlyObligations.getOrDefault(years.get(0), BigDecimal.ZERO);
            BigDecimal last = yearlyObligations.getOrDefault(years.get(years.size() - 1), BigDecimal.ZERO);
            if (first.signum() == 0) {
                return FundingTrend.NEW;
            }
            return compare(first, last);
        }

        boolean hasEarlier = years.subList(0, years.size() - 2).stream()
                .anyMatch(y -> yearlyObligations.getOrDefault(y, BigDecimal.ZERO).signum() > 0);
        if (!hasEarlier) {
            return FundingTrend.NEW;
        }

        int mid = years.size() / 2;
        BigDecimal firstHalf = sum(yearlyObligations, years.subList(0, mid));
        BigDecimal secondHalf = sum(yearlyObligations, years.subList(mid, years.size()));
        if (firstHalf.signum() <= 0) {
            return FundingTrend.STABLE;
        }
        return compare(firstHalf, secondHalf);
    }

    private static FundingTrend compare(BigDecimal earlier, BigDecimal later) {
        if (later.compareTo(earlier.multiply(GROWTH)) > 0) {
            return FundingTrend.INCREASING;
        }
        if (later.compareTo(earlier.multiply(DECLINE)) < 0) {
            return FundingTrend.DECREASING;
        }
        return FundingTrend.STABLE;
    }

    private static BigDecimal sum(Map<Integer, BigDecimal> yearly, List<Integer> years) {
        BigDecimal total = BigDecimal.ZERO;
        for (Integer year : years) {
            total = total.add(yearly.getOrDefault(year, BigDecimal.ZERO));
        }
        return total;
    }
}
