package com.equorum.governance.domain;

import jakarta.annotation.Nullable;
import jakarta.persistence.*;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Tokens a principal holds in governance custody. One row per principal;
 * the row is deleted on unlock, so "no row" is the zero lock.
 */
@Entity
@Table(name = "token_locks")
public class TokenLock {

    @Id
    @Column(length = 128)
    private String principal;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger amount = BigInteger.ZERO;

    @Column(name = "locked_at", nullable = false)
    private Instant lockedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Nullable
    @Column(name = "committed_until")
    private Instant committedUntil;

    public TokenLock() {}

    public TokenLock(String principal, Instant now) {
        this.principal = principal;
        this.lockedAt = now;
        this.updatedAt = now;
    }

    /** Inclusive of {@code committedUntil}, like the voting window it mirrors. */
    public boolean isCommittedAt(Instant now) {
        return committedUntil != null && !now.isAfter(committedUntil);
    }

    /** Keeps the later of the current commitment and {@code until}. */
    public void commitUntil(Instant until) {
        if (committedUntil == null || until.isAfter(committedUntil)) {
            committedUntil = until;
        }
    }

    public String getPrincipal() { return principal; }
    public void setPrincipal(String principal) { this.principal = principal; }

    public BigInteger getAmount() { return amount; }
    public void setAmount(BigInteger amount) { this.amount = amount; }

    public Instant getLockedAt() { return lockedAt; }
    public void setLockedAt(Instant lockedAt) { this.lockedAt = lockedAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    @Nullable
    public Instant getCommittedUntil() { return committedUntil; }
    public void setCommittedUntil(@Nullable Instant committedUntil) { this.committedUntil = committedUntil; }
}
