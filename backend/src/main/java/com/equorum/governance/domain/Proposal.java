package com.equorum.governance.domain;

import jakarta.annotation.Nullable;
import jakarta.persistence.*;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A proposal record. Lifecycle state is not a column: see {@link ProposalState#derive}.
 */
@Entity
@Table(name = "proposals")
public class Proposal {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String proposer;

    @Column(nullable = false, length = 4000)
    private String description;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "proposal_actions", joinColumns = @JoinColumn(name = "proposal_id"))
    @OrderColumn(name = "action_index")
    private List<ProposalAction> actions = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "voting_starts_at", nullable = false)
    private Instant votingStartsAt;

    @Column(name = "voting_ends_at", nullable = false)
    private Instant votingEndsAt;

    @Column(name = "for_votes", nullable = false, precision = 78, scale = 0)
    private BigInteger forVotes = BigInteger.ZERO;

    @Column(name = "against_votes", nullable = false, precision = 78, scale = 0)
    private BigInteger againstVotes = BigInteger.ZERO;

    @Nullable
    private Instant eta;

    @Column(nullable = false)
    private boolean executed;

    @Column(nullable = false)
    private boolean canceled;

    public Proposal() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getProposer() { return proposer; }
    public void setProposer(String proposer) { this.proposer = proposer; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public List<ProposalAction> getActions() { return actions; }
    public void setActions(List<ProposalAction> actions) { this.actions = actions; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getVotingStartsAt() { return votingStartsAt; }
    public void setVotingStartsAt(Instant votingStartsAt) { this.votingStartsAt = votingStartsAt; }

    public Instant getVotingEndsAt() { return votingEndsAt; }
    public void setVotingEndsAt(Instant votingEndsAt) { this.votingEndsAt = votingEndsAt; }

    public BigInteger getForVotes() { return forVotes; }
    public void setForVotes(BigInteger forVotes) { this.forVotes = forVotes; }

    public BigInteger getAgainstVotes() { return againstVotes; }
    public void setAgainstVotes(BigInteger againstVotes) { this.againstVotes = againstVotes; }

    @Nullable
    public Instant getEta() { return eta; }
    public void setEta(@Nullable Instant eta) { this.eta = eta; }

    public boolean isExecuted() { return executed; }
    public void setExecuted(boolean executed) { this.executed = executed; }

    public boolean isCanceled() { return canceled; }
    public void setCanceled(boolean canceled) { this.canceled = canceled; }
}
