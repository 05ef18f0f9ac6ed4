package com.entity.profiling.award;

import com.entity.profiling.core.model.AwardRecord;
import com.entity.profiling.core.model.AwardSummary;
import com.entity.profiling.core.model.FundingTrend;
import com.entity.profiling.core.model.ProgramTotal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Sums the award records attributed to one entity.
 * Only records the matcher attributed (alias or fuzzy) may be passed in; ambiguous and
 * unmatched records go to the unattributed report instead.
 */
public class AwardAggregator {
    private static final Logger log = LoggerFactory.getLogger(AwardAggregator.class);

    private final FiscalYearRange range;

    public AwardAggregator() {
        this(null);
    }

    /**
     * @param range fiscal years for the yearly breakdown and trend; when null the range of
     *              each entity's own records is used
     */
    public AwardAggregator(FiscalYearRange range) {
        this.range = range;
    }

    public AwardSummary aggregate(String entityId, List<AwardRecord> matchedRecords) {
        BigDecimal total = BigDecimal.ZERO;
        Map<String, ProgramTotal> programs = new TreeMap<>();
        List<String> recordIds = new ArrayList<>(matchedRecords.size());
        for (AwardRecord record : matchedRecords) {
            total = total.add(record.amount());
            programs.merge(record.programId(), ProgramTotal.ZERO.add(record.amount()),
                    (a, b) -> new ProgramTotal(a.recordCount() + b.recordCount(), a.total().add(b.total())));
            recordIds.add(record.recordId());
        }
        Collections.sort(recordIds);

        Optional<FiscalYearRange> years = range != null ? Optional.of(range) : FiscalYearRange.spanning(matchedRecords);
        Map<Integer, BigDecimal> yearly = new TreeMap<>();
        FundingTrend trend = FundingTrend.NONE;
        if (years.isPresent()) {
            FiscalYearRange r = years.get();
            r.years().forEach(y -> yearly.put(y, BigDecimal.ZERO));
            for (AwardRecord record : matchedRecords) {
                OptionalInt fy = FiscalYears.parse(record.fiscalYear());
                if (fy.isPresent() && r.contains(fy.getAsInt())) {
                    yearly.merge(fy.getAsInt(), record.amount(), BigDecimal::add);
                }
            }
            trend = FundingTrends.compute(yearly, r);
        }

        log.debug("awards.aggregated entityId={} records={} total={} trend={}",
                entityId, matchedRecords.size(), total.toPlainString(), trend);
        return new AwardSummary(total, programs, matchedRecords.size(), recordIds, yearly, trend);
    }
}
