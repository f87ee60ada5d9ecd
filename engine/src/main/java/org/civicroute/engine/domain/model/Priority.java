package org.civicroute.engine.domain.model;

import java.util.Locale;

/**
 * Work item priority as reported by the intake service.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    /**
     * Parse the lower-case wire value, defaulting to MEDIUM for blanks.
     */
    public static Priority fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return MEDIUM;
        }
        return Priority.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
