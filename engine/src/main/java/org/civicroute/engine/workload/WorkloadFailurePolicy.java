package org.civicroute.engine.workload;

import java.util.Locale;

/**
 * What to do when an open-item count cannot be obtained while ranking.
 */
public enum WorkloadFailurePolicy {

    /** Abort the assignment attempt with a WorkloadQueryException. */
    FAIL_CLOSED,

    /**
     * Keep going: a unit with unknown load is scored as exactly full and a staff
     * member with unknown load is ranked after everyone with a known count.
     */
    FAIL_OPEN;

    public static WorkloadFailurePolicy fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return FAIL_CLOSED;
        }
        return WorkloadFailurePolicy.valueOf(code.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
