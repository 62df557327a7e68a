package com.moneylens.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a bill or scheduled loan payment.
 * SCHEDULED/POSTED -> OVERDUE when the due date passes; any open state -> PAID when matched. PAID is terminal.
 */
public enum ObligationStatus {
    SCHEDULED,
    POSTED,
    OVERDUE,
    PAID;

    private static final Set<ObligationStatus> OPEN = EnumSet.of(SCHEDULED, POSTED, OVERDUE);

    public static Set<ObligationStatus> openStatuses() {
        return EnumSet.copyOf(OPEN);
    }

    /** True for states the reconciliation matcher may still resolve. */
    public boolean isOpen() {
        return OPEN.contains(this);
    }

    /** True for states that turn OVERDUE once the due date has passed. */
    public boolean canBecomeOverdue() {
        return this == SCHEDULED || this == POSTED;
    }
}
