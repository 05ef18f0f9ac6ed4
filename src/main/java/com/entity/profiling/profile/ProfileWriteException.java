package com.entity.profiling.profile;

/**
 * Thrown when one entity's profile cannot be persisted. The previous profile file,
 * if any, is left intact.
 */
public class ProfileWriteException extends RuntimeException {

    private final String entityId;

    public ProfileWriteException(String entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
