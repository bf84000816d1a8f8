package com.equorum.governance.service;

import com.equorum.governance.config.GovernanceProperties;
import com.equorum.governance.domain.Proposal;
import com.equorum.governance.domain.ProposalAction;
import com.equorum.governance.domain.ProposalState;
import com.equorum.governance.domain.ProposalVote;
import com.equorum.governance.domain.TokenLock;
import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import com.equorum.governance.repository.ProposalRepository;
import com.equorum.governance.repository.ProposalVoteRepository;
import io.micronaut.data.model.Pageable;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Proposal records, vote receipts and the derived lifecycle state.
 *
 * State is never written: {@link #state} derives it from tallies, the voting
 * window, the queue/execute/cancel markers and the clock.
 */
@Singleton
public class ProposalStore {

    private static final Logger log = LoggerFactory.getLogger(ProposalStore.class);
    private static final BigInteger BASIS_POINTS = BigInteger.valueOf(10_000);

    @Inject ProposalRepository proposalRepository;
    @Inject ProposalVoteRepository voteRepository;
    @Inject VotingPowerLedger votingPowerLedger;
    @Inject GovernanceProperties properties;
    @Inject EventLogService eventLog;
    @Inject EntityManager entityManager;
    @Inject Clock clock;

    @Transactional
    public Proposal propose(String proposer, List<ProposalAction> actions, String description) {
        if (description == null || description.isBlank()) {
            throw new GovernanceException(ErrorCode.EMPTY_DESCRIPTION, "Proposal description must not be empty");
        }
        if (actions == null || actions.isEmpty()) {
            throw new GovernanceException(ErrorCode.EMPTY_ACTIONS, "A proposal needs at least one action");
        }
        int maxActions = properties.getVoting().getMaxActions();
        if (actions.size() > maxActions) {
            throw new GovernanceException(ErrorCode.TOO_MANY_ACTIONS,
                "A proposal may carry at most " + maxActions + " actions, got " + actions.size());
        }
        Set<ProposalAction> distinct = new HashSet<>();
        for (ProposalAction action : actions) {
            if (!distinct.add(action)) {
                throw new GovernanceException(ErrorCode.DUPLICATE_ACTION,
                    "Action " + action.getTarget() + "." + action.getSignature() + " appears twice");
            }
        }

        Instant now = clock.instant();
        TokenLock lock = votingPowerLedger.lockForUpdate(proposer);
        BigInteger power = lock == null ? BigInteger.ZERO : VotingPowerLedger.powerOf(lock.getAmount());
        votingPowerLedger.requireEligible(proposer, lock, now);
        if (power.compareTo(properties.getVoting().proposalThresholdPower()) < 0) {
            throw new GovernanceException(ErrorCode.BELOW_THRESHOLD,
                "Voting power " + power + " is below the proposal threshold of " + properties.getVoting().getProposalThreshold());
        }

        Proposal proposal = new Proposal();
        proposal.setProposer(proposer);
        proposal.setDescription(description);
        proposal.setActions(new ArrayList<>(actions));
        proposal.setCreatedAt(now);
        Instant start = now.plus(properties.getVoting().getVotingDelay());
        proposal.setVotingStartsAt(start);
        proposal.setVotingEndsAt(start.plus(properties.getVoting().getVotingPeriod()));
        proposal = proposalRepository.save(proposal);

        votingPowerLedger.commit(lock, proposal.getVotingEndsAt());

        log.info("Proposal created: id={} proposer={} actions={} votingEndsAt={}",
            proposal.getId(), proposer, actions.size(), proposal.getVotingEndsAt());
        eventLog.record("proposal_created", proposer, subject(proposal.getId()),
            Map.of("actions", actions.size(), "votingEndsAt", proposal.getVotingEndsAt().toString()));
        return proposal;
    }

    @Transactional
    public ProposalVote castVote(String voter, Long proposalId, boolean support) {
        Proposal proposal = lockProposal(proposalId);
        Instant now = clock.instant();
        ProposalState state = stateOf(proposal, now);
        if (state != ProposalState.ACTIVE) {
            throw new GovernanceException(ErrorCode.VOTING_CLOSED,
                "Proposal " + proposalId + " is " + state + ", voting is not open");
        }
        if (voteRepository.existsByProposalIdAndVoter(proposalId, voter)) {
            throw new GovernanceException(ErrorCode.ALREADY_VOTED, voter + " already voted on proposal " + proposalId);
        }

        TokenLock lock = votingPowerLedger.lockForUpdate(voter);
        votingPowerLedger.requireEligible(voter, lock, now);
        BigInteger weight = lock == null ? BigInteger.ZERO : VotingPowerLedger.powerOf(lock.getAmount());
        if (weight.signum() == 0) {
            throw new GovernanceException(ErrorCode.NO_VOTING_POWER, voter + " has no voting power");
        }

        if (support) {
            proposal.setForVotes(proposal.getForVotes().add(weight));
        } else {
            proposal.setAgainstVotes(proposal.getAgainstVotes().add(weight));
        }
        ProposalVote vote = voteRepository.save(new ProposalVote(proposalId, voter, support, weight, now));
        votingPowerLedger.commit(lock, proposal.getVotingEndsAt());

        log.info("Vote cast: proposal={} voter={} support={} weight={} for={} against={}",
            proposalId, voter, support, weight, proposal.getForVotes(), proposal.getAgainstVotes());
        eventLog.record("vote_cast", voter, subject(proposalId),
            Map.of("support", support, "weight", weight.toString()));
        return vote;
    }

    /**
     * {@code floor(sqrt(totalLocked * quorumBasisPoints / 10000))}, in voting-power units so it
     * compares directly with square-root tallies. Recomputed from the live locked supply.
     */
    @Transactional
    public BigInteger quorum() {
        BigInteger share = votingPowerLedger.totalLocked()
            .multiply(BigInteger.valueOf(properties.getVoting().getQuorumBasisPoints()))
            .divide(BASIS_POINTS);
        return share.sqrt();
    }

    @Transactional
    public ProposalState state(Long proposalId) {
        return stateOf(find(proposalId), clock.instant());
    }

    public ProposalState stateOf(Proposal proposal, Instant now) {
        return ProposalState.derive(proposal, now, this::quorum, properties.getTimelock().getGracePeriod());
    }

    @Transactional
    public Proposal find(Long proposalId) {
        return proposalRepository.findById(proposalId)
            .orElseThrow(() -> new GovernanceException(ErrorCode.PROPOSAL_NOT_FOUND, "Proposal not found: " + proposalId));
    }

    /** Row-locks the proposal for the rest of the caller's transaction. */
    public Proposal lockProposal(Long proposalId) {
        Proposal proposal = entityManager.find(Proposal.class, proposalId, LockModeType.PESSIMISTIC_WRITE);
        if (proposal == null) {
            throw new GovernanceException(ErrorCode.PROPOSAL_NOT_FOUND, "Proposal not found: " + proposalId);
        }
        return proposal;
    }

    @Transactional
    public List<Proposal> page(Pagination pagination) {
        if (pagination.size() == 0) {
            return List.of();
        }
        return proposalRepository.findNewestFirst(Pageable.from(pagination.page(), pagination.itemsPerPage()));
    }

    @Transactional
    public List<ProposalVote> votes(Long proposalId) {
        find(proposalId);
        return voteRepository.findByProposalIdOrderByIdAsc(proposalId);
    }

    @Transactional
    public ProposalVote receipt(Long proposalId, String voter) {
        find(proposalId);
        return voteRepository.findByProposalIdAndVoter(proposalId, voter)
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND,
                "No vote by " + voter + " on proposal " + proposalId));
    }

    public long proposalCount() {
        return proposalRepository.count();
    }

    static String subject(Long proposalId) {
        return "proposal:" + proposalId;
    }
}
