package com.equorum.governance.domain;

import jakarta.annotation.Nullable;
import jakarta.persistence.*;

import java.math.BigInteger;
import java.time.Instant;

/** A delayed call, keyed by its content hash. */
@Entity
@Table(name = "timelock_entries")
public class TimelockEntry {

    @Id
    @Column(length = 64)
    private String hash;

    @Column(nullable = false, length = 64)
    private String target;

    @Column(name = "call_value", nullable = false, precision = 78, scale = 0)
    private BigInteger value = BigInteger.ZERO;

    @Column(nullable = false, length = 256)
    private String signature;

    @Column(nullable = false, length = 4000)
    private String calldata;

    @Column(nullable = false)
    private Instant eta;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntryStatus status = EntryStatus.QUEUED;

    @Nullable
    @Column(name = "proposal_id")
    private Long proposalId;

    @Column(name = "queued_at", nullable = false)
    private Instant queuedAt;

    @Nullable
    @Column(name = "executed_at")
    private Instant executedAt;

    @Nullable
    @Column(name = "canceled_at")
    private Instant canceledAt;

    public TimelockEntry() {}

    public String getHash() { return hash; }
    public void setHash(String hash) { this.hash = hash; }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    public BigInteger getValue() { return value; }
    public void setValue(BigInteger value) { this.value = value; }

    public String getSignature() { return signature; }
    public void setSignature(String signature) { this.signature = signature; }

    public String getCalldata() { return calldata; }
    public void setCalldata(String calldata) { this.calldata = calldata; }

    public Instant getEta() { return eta; }
    public void setEta(Instant eta) { this.eta = eta; }

    public EntryStatus getStatus() { return status; }
    public void setStatus(EntryStatus status) { this.status = status; }

    @Nullable
    public Long getProposalId() { return proposalId; }
    public void setProposalId(@Nullable Long proposalId) { this.proposalId = proposalId; }

    public Instant getQueuedAt() { return queuedAt; }
    public void setQueuedAt(Instant queuedAt) { this.queuedAt = queuedAt; }

    @Nullable
    public Instant getExecutedAt() { return executedAt; }
    public void setExecutedAt(@Nullable Instant executedAt) { this.executedAt = executedAt; }

    @Nullable
    public Instant getCanceledAt() { return canceledAt; }
    public void setCanceledAt(@Nullable Instant canceledAt) { this.canceledAt = canceledAt; }
}
