package com.entity.profiling.core;

/**
 * Runtime exception thrown when reference data a run depends on (entity index,
 * alias table, crosswalk) is missing or unreadable. Fatal: the run aborts before
 * any profile is written.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message) {
        super(message);
    }

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
