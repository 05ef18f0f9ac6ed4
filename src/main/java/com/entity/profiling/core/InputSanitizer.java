package com.entity.profiling.core;

import java.util.regex.Pattern;

/**
 * Input validation for values that flow into file names or matching.
 */
public final class InputSanitizer {

    /** Maximum allowed length for recipient names. */
    public static final int MAX_RECIPIENT_NAME_LENGTH = 1000;

    /** Maximum allowed length for entity ids used as storage keys. */
    public static final int MAX_ENTITY_ID_LENGTH = 200;

    private static final Pattern SAFE_KEY = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates an entity id for use as a per-entity storage key (file name).
     *
     * @throws IllegalArgumentException if the id is blank, too long, or not filesystem safe
     */
    public static void validateEntityId(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("Entity id must not be null or blank");
        }
        if (entityId.length() > MAX_ENTITY_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "Entity id exceeds maximum length of " + MAX_ENTITY_ID_LENGTH +
                            " characters (was " + entityId.length() + ")");
        }
        if (!SAFE_KEY.matcher(entityId).matches() || entityId.contains("..")) {
            throw new IllegalArgumentException(
                    "Entity id must contain only letters, digits, '.', '_' and '-', got: '" + entityId + "'");
        }
    }

    /**
     * Validates a raw recipient name before matching.
     * Rejects null, blank, overly long, or control-character-containing names.
     *
     * @throws IllegalArgumentException if the name is invalid
     */
    public static void validateRecipientName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Recipient name must not be null or blank");
        }
        if (name.length() > MAX_RECIPIENT_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "Recipient name exceeds maximum length of " + MAX_RECIPIENT_NAME_LENGTH +
                            " characters (was " + name.length() + ")");
        }
        if (containsControlCharacters(name)) {
            throw new IllegalArgumentException("Recipient name must not contain control characters");
        }
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F),
     * excluding tab.
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if ((c < 0x20 && c != '\t') || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
