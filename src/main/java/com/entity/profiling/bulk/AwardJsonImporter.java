package com.entity.profiling.bulk;

import com.entity.profiling.core.JsonSupport;
import com.entity.profiling.core.model.AwardRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON importer for raw award records: an array of objects with the same snake_case
 * keys as the CSV format.
 *
 * <pre>
 * [
 *   {"record_id": "A-1", "recipient_name": "Hopi Tribe", "amount": 125000.00,
 *    "program_id": "BRIC", "fiscal_year": "FY2024", "recipient_state": "AZ"}
 * ]
 * </pre>
 */
public class AwardJsonImporter implements RecordImporter<AwardRecord> {
    private static final Logger log = LoggerFactory.getLogger(AwardJsonImporter.class);
    private static final int PROGRESS_INTERVAL = 1000;

    private final ObjectMapper mapper;

    public AwardJsonImporter() {
        this(JsonSupport.mapper());
    }

    public AwardJsonImporter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ImportResult<AwardRecord> importRecords(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<AwardRecord> records = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;

        JsonNode root;
        try {
            root = mapper.readTree(reader);
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            return new ImportResult<>(List.of(), 0,
                    List.of(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage())));
        }
        if (root == null || root.isMissingNode()) {
            return ImportResult.empty();
        }
        if (!root.isArray()) {
            return new ImportResult<>(List.of(), 0,
                    List.of(new ImportResult.ImportError(0, "", "expected a JSON array of award objects")));
        }

        for (JsonNode node : root) {
            totalRecords++;
            try {
                records.add(parse(node));
            } catch (IllegalArgumentException e) {
                errors.add(new ImportResult.ImportError(totalRecords, node.toString(), e.getMessage()));
                log.warn("import.error element={} error={}", totalRecords, e.getMessage());
            }
            if (totalRecords % PROGRESS_INTERVAL == 0) {
                cb.onProgress(totalRecords, root.size(), "Processed " + totalRecords + " records");
            }
        }

        ImportResult<AwardRecord> result = new ImportResult<>(records, totalRecords, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed format={} result={}", getFormat(), result);
        return result;
    }

    private AwardRecord parse(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("element is not an object");
        }
        JsonNode name = node.get("recipient_name");
        if (name == null || name.isNull()) {
            throw new IllegalArgumentException("missing value for 'recipient_name'");
        }
        JsonNode amount = node.get("amount");
        if (amount == null || amount.isNull()) {
            throw new IllegalArgumentException("missing amount");
        }
        return new AwardRecord(
                text(node, "record_id"),
                name.asText(),
                amount.isNumber() ? amount.decimalValue() : Amounts.parse(amount.asText()),
                text(node, "program_id"),
                text(node, "fiscal_year"),
                node.hasNonNull("recipient_state") ? node.get("recipient_state").asText() : null);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText().trim();
    }

    @Override
    public String getFormat() {
        return "json";
    }
}
