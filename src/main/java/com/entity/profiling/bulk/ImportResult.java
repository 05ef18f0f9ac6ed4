package com.entity.profiling.bulk;

import java.util.List;

/**
 * Result of a bulk import: the records that parsed, plus one error per rejected row.
 *
 * @param records      successfully parsed records, in input order
 * @param totalRecords total number of data rows seen
 * @param errors       rejected rows
 * @param <T>          record type
 */
public record ImportResult<T>(List<T> records, long totalRecords, List<ImportResult.ImportError> errors) {

    public ImportResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static <T> ImportResult<T> empty() {
        return new ImportResult<>(List.of(), 0, List.of());
    }

    public long successCount() {
        return records.size();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Represents an error that occurred during import of a specific record.
     *
     * @param lineNumber the line (CSV) or element (JSON) number in the input, 1-based; 0 for stream errors
     * @param input      the raw input that failed
     * @param message    the error message
     */
    public record ImportError(long lineNumber, String input, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", imported=" + records.size() +
                ", errors=" + errors.size() + '}';
    }
}
