package com.entity.profiling.bulk;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads raw records of one type from a specific format (CSV, JSON).
 * A bad row never aborts the import: it is reported as an {@link ImportResult.ImportError}
 * and the remaining rows are still read.
 *
 * @param <T> record type
 */
public interface RecordImporter<T> {

    ImportResult<T> importRecords(Reader reader, ProgressCallback callback);

    /**
     * Imports from a UTF-8 file. An unreadable file yields a single stream error.
     */
    default ImportResult<T> importRecords(Path path, ProgressCallback callback) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return importRecords(reader, callback);
        } catch (IOException e) {
            return new ImportResult<>(List.of(), 0,
                    List.of(new ImportResult.ImportError(0, path.toString(), "IO error: " + e.getMessage())));
        }
    }

    /**
     * Returns the format supported by this importer (e.g., "csv", "json").
     */
    String getFormat();
}
