package com.entity.profiling.bulk;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Header-driven CSV import. Columns are located by (case-insensitive) header name, so
 * their order in the file does not matter; subclasses turn one row into one record.
 *
 * @param <T> record type
 */
public abstract class AbstractCsvImporter<T> implements RecordImporter<T> {
    private static final Logger log = LoggerFactory.getLogger(AbstractCsvImporter.class);
    private static final int PROGRESS_INTERVAL = 1000;

    /**
     * Columns the header must contain.
     */
    protected abstract List<String> requiredColumns();

    /**
     * Parses one row.
     *
     * @param row column name (lower case) to trimmed cell value; optional columns may be absent
     * @throws IllegalArgumentException if the row is malformed
     */
    protected abstract T parseRow(Map<String, String> row);

    @Override
    public ImportResult<T> importRecords(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<T> records = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;

        try (CSVReader csv = new CSVReaderBuilder(reader).build()) {
            String[] header = csv.readNext();
            if (header == null) {
                return ImportResult.empty();
            }
            List<String> columns = new ArrayList<>(header.length);
            for (String h : header) {
                columns.add(h.trim().replace("\uFEFF", "").toLowerCase(Locale.ROOT));
            }
            for (String required : requiredColumns()) {
                if (!columns.contains(required)) {
                    errors.add(new ImportResult.ImportError(1, String.join(",", header),
                            "missing required column '" + required + "'"));
                    log.error("import.failed format={} missingColumn={}", getFormat(), required);
                    return new ImportResult<>(List.of(), 0, errors);
                }
            }

            String[] line;
            while (true) {
                try {
                    line = csv.readNext();
                } catch (CsvValidationException e) {
                    totalRecords++;
                    errors.add(new ImportResult.ImportError(csv.getLinesRead(), "", e.getMessage()));
                    log.warn("import.error line={} error={}", csv.getLinesRead(), e.getMessage());
                    continue;
                }
                if (line == null) {
                    break;
                }
                if (line.length == 1 && line[0].isBlank()) {
                    continue;
                }
                totalRecords++;
                long lineNumber = csv.getLinesRead();
                try {
                    if (line.length > columns.size()) {
                        throw new IllegalArgumentException(
                                "expected " + columns.size() + " columns, got " + line.length);
                    }
                    Map<String, String> row = new HashMap<>();
                    for (int i = 0; i < line.length; i++) {
                        row.put(columns.get(i), line[i].trim());
                    }
                    records.add(parseRow(row));
                } catch (IllegalArgumentException e) {
                    String input = String.join(",", line);
                    errors.add(new ImportResult.ImportError(lineNumber, input, e.getMessage()));
                    log.warn("import.error line={} input='{}' error={}", lineNumber, input, e.getMessage());
                }

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Processed " + totalRecords + " records");
                }
            }
        } catch (IOException | CsvValidationException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }

        ImportResult<T> result = new ImportResult<>(records, totalRecords, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed format={} result={}", getFormat(), result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    /**
     * Returns the value of a required column, rejecting blanks.
     */
    protected static String required(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("missing value for '" + column + "'");
        }
        return value;
    }

    /**
     * Returns the value of an optional column, or null when absent or blank.
     */
    protected static String optional(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null || value.isEmpty() ? null : value;
    }
}
