package com.entity.profiling.award;

import com.entity.profiling.core.model.AwardRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes repeated award records before matching. Multi-year awards show up once per
 * fiscal-year query, so the record id is the key and the first occurrence wins.
 * Records without an id fall back to a recipient|program|amount|year composite key.
 */
public class AwardDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(AwardDeduplicator.class);

    public Result deduplicate(List<AwardRecord> records) {
        Set<String> seen = new HashSet<>();
        List<AwardRecord> kept = new ArrayList<>(records.size());
        for (AwardRecord record : records) {
            if (seen.add(keyOf(record))) {
                kept.add(record);
            }
        }
        int removed = records.size() - kept.size();
        log.info("awards.deduplicated input={} kept={} removed={}", records.size(), kept.size(), removed);
        return new Result(kept, removed);
    }

    static String keyOf(AwardRecord record) {
        String id = record.recordId().trim();
        if (!id.isEmpty()) {
            return id;
        }
        return record.recipientName() + "|" + record.programId() + "|"
                + record.amount().toPlainString() + "|" + record.fiscalYear();
    }

    /**
     * @param records    unique records in input order
     * @param duplicates number of records dropped
     */
    public record Result(List<AwardRecord> records, int duplicates) {
        public Result {
            records = List.copyOf(records);
        }
    }
}
