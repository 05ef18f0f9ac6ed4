package com.entity.profiling.bulk;

import com.entity.profiling.core.model.AwardRecord;

import java.util.List;
import java.util.Map;

/**
 * CSV importer for raw award records.
 *
 * <pre>
 * record_id,recipient_name,amount,program_id,fiscal_year,recipient_state
 * A-1,"HOPI TRIBE, AZ",125000.00,BRIC,2024,AZ
 * </pre>
 *
 * {@code recipient_state} is optional. The recipient name is not validated here; the
 * matcher reports unusable names as unattributed so they still reach the report.
 */
public class AwardCsvImporter extends AbstractCsvImporter<AwardRecord> {

    @Override
    protected List<String> requiredColumns() {
        return List.of("record_id", "recipient_name", "amount", "program_id", "fiscal_year");
    }

    @Override
    protected AwardRecord parseRow(Map<String, String> row) {
        String recordId = row.getOrDefault("record_id", "");
        String recipient = row.get("recipient_name");
        if (recipient == null) {
            throw new IllegalArgumentException("missing value for 'recipient_name'");
        }
        return new AwardRecord(
                recordId,
                recipient,
                Amounts.parse(row.get("amount")),
                row.getOrDefault("program_id", ""),
                row.getOrDefault("fiscal_year", ""),
                optional(row, "recipient_state"));
    }
}
