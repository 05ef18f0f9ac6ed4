package com.entity.profiling.award;

import com.entity.profiling.core.model.AwardRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * Inclusive range of fiscal years covered by yearly breakdowns and trends.
 */
public record FiscalYearRange(int start, int end) {

    public FiscalYearRange {
        if (end < start) {
            throw new IllegalArgumentException("Fiscal year range end " + end + " precedes start " + start);
        }
    }

    public static FiscalYearRange of(int start, int end) {
        return new FiscalYearRange(start, end);
    }

    /**
     * The smallest range holding every parseable fiscal year of the records.
     */
    public static Optional<FiscalYearRange> spanning(Collection<AwardRecord> records) {
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (AwardRecord record : records) {
            OptionalInt year = FiscalYears.parse(record.fiscalYear());
            if (year.isPresent()) {
                min = Math.min(min, year.getAsInt());
                max = Math.max(max, year.getAsInt());
            }
        }
        return min <= max ? Optional.of(new FiscalYearRange(min, max)) : Optional.empty();
    }

    public boolean contains(int year) {
        return year >= start && year <= end;
    }

    public int length() {
        return end - start + 1;
    }

    public List<Integer> years() {
        return IntStream.rangeClosed(start, end).boxed().toList();
    }
}
