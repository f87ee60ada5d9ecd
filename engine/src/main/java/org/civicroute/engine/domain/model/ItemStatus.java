package org.civicroute.engine.domain.model;

import java.util.Locale;

/**
 * Lifecycle status of a work item.
 */
public enum ItemStatus {
    NEW,
    IN_PROGRESS,
    RESOLVED,
    CLOSED,
    REJECTED;

    public static ItemStatus fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return NEW;
        }
        return ItemStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Open items count towards unit and staff workload.
     */
    public boolean isOpen() {
        return this == NEW || this == IN_PROGRESS;
    }

    public boolean isTerminal() {
        return this == RESOLVED || this == CLOSED || this == REJECTED;
    }
}
