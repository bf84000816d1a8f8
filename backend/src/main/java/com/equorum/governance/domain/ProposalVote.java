package com.equorum.governance.domain;

import jakarta.persistence.*;

import java.math.BigInteger;
import java.time.Instant;

/** Vote receipt. The unique key doubles as the per-proposal voter set. */
@Entity
@Table(name = "proposal_votes",
       uniqueConstraints = @UniqueConstraint(name = "uq_vote_proposal_voter", columnNames = {"proposal_id", "voter"}))
public class ProposalVote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "proposal_id", nullable = false)
    private Long proposalId;

    @Column(nullable = false, length = 128)
    private String voter;

    @Column(nullable = false)
    private boolean support;

    @Column(nullable = false, precision = 78, scale = 0)
    private BigInteger weight;

    @Column(name = "cast_at", nullable = false)
    private Instant castAt;

    public ProposalVote() {}

    public ProposalVote(Long proposalId, String voter, boolean support, BigInteger weight, Instant castAt) {
        this.proposalId = proposalId;
        this.voter = voter;
        this.support = support;
        this.weight = weight;
        this.castAt = castAt;
    }

    public Long getId() { return id; }
    public Long getProposalId() { return proposalId; }
    public String getVoter() { return voter; }
    public boolean isSupport() { return support; }
    public BigInteger getWeight() { return weight; }
    public Instant getCastAt() { return castAt; }
}
