package com.equorum.governance.domain;

import java.time.Duration;
import java.time.Instant;

/** Observable state of a timelock entry. */
public enum EntryState {
    UNQUEUED,
    QUEUED,
    EXECUTED,
    CANCELED,
    EXPIRED;

    public static EntryState derive(TimelockEntry entry, Instant now, Duration gracePeriod) {
        if (entry == null) {
            return UNQUEUED;
        }
        return switch (entry.getStatus()) {
            case EXECUTED -> EXECUTED;
            case CANCELED -> CANCELED;
            case QUEUED -> now.isAfter(entry.getEta().plus(gracePeriod)) ? EXPIRED : QUEUED;
        };
    }
}
