package com.equorum.governance.domain;

/** Stored status of a timelock entry. EXPIRED is derived, see {@link EntryState}. */
public enum EntryStatus {
    QUEUED,
    EXECUTED,
    CANCELED
}
