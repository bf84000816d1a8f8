package com.equorum.governance.domain;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

public enum ProposalState {
    PENDING,
    ACTIVE,
    SUCCEEDED,
    DEFEATED,
    QUEUED,
    EXECUTED,
    CANCELED,
    EXPIRED;

    /**
     * Pure function of the stored proposal fields and the clock.
     *
     * @param quorum      live quorum in voting-power units, only read once voting has closed
     * @param gracePeriod timelock grace period, bounds QUEUED
     */
    public static ProposalState derive(Proposal p, Instant now, Supplier<BigInteger> quorum, Duration gracePeriod) {
        if (p.isCanceled()) {
            return CANCELED;
        }
        if (p.isExecuted()) {
            return EXECUTED;
        }
        if (now.isBefore(p.getVotingStartsAt())) {
            return PENDING;
        }
        if (!now.isAfter(p.getVotingEndsAt())) {
            return ACTIVE;
        }
        if (p.getEta() != null) {
            return now.isAfter(p.getEta().plus(gracePeriod)) ? EXPIRED : QUEUED;
        }
        // ties defeat
        if (p.getForVotes().compareTo(p.getAgainstVotes()) > 0 && p.getForVotes().compareTo(quorum.get()) >= 0) {
            return SUCCEEDED;
        }
        return DEFEATED;
    }
}
