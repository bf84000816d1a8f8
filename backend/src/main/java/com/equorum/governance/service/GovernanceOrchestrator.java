package com.equorum.governance.service;

import com.equorum.governance.config.GovernanceProperties;
import com.equorum.governance.domain.EntryStatus;
import com.equorum.governance.domain.Proposal;
import com.equorum.governance.domain.ProposalAction;
import com.equorum.governance.domain.ProposalState;
import com.equorum.governance.domain.ProposalVote;
import com.equorum.governance.domain.TimelockEntry;
import com.equorum.governance.dto.ActionRequest;
import com.equorum.governance.dto.ActionResponse;
import com.equorum.governance.dto.AdminResponse;
import com.equorum.governance.dto.CreateProposalRequest;
import com.equorum.governance.dto.GovernanceParametersResponse;
import com.equorum.governance.dto.ProposalPage;
import com.equorum.governance.dto.ProposalResponse;
import com.equorum.governance.dto.TimelockEntryResponse;
import com.equorum.governance.dto.VoteResponse;
import com.equorum.governance.error.ErrorCode;
import com.equorum.governance.error.GovernanceException;
import com.equorum.governance.repository.TimelockEntryRepository;
import com.equorum.governance.target.ActionCall;
import com.equorum.governance.target.TargetRegistry;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.transaction.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Composition root of the governance pipeline: propose, vote, queue, execute
 * and cancel, translating a succeeded proposal into timelock entries.
 *
 * The orchestrator talks to the timelock as {@code governance.orchestrator-principal};
 * it can only queue and execute once it holds the timelock admin role.
 */
@Singleton
public class GovernanceOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GovernanceOrchestrator.class);

    @Inject ProposalStore proposalStore;
    @Inject TimelockQueue timelockQueue;
    @Inject VotingPowerLedger votingPowerLedger;
    @Inject TargetRegistry targetRegistry;
    @Inject TimelockEntryRepository entryRepository;
    @Inject GovernanceProperties properties;
    @Inject EventLogService eventLog;
    @Inject Clock clock;

    @Transactional
    public ProposalResponse propose(String proposer, CreateProposalRequest req) {
        List<ProposalAction> actions = new ArrayList<>();
        if (req.actions() != null) {
            for (ActionRequest a : req.actions()) {
                if (a == null) {
                    throw new GovernanceException(ErrorCode.INVALID_TARGET, "Action must not be null");
                }
                BigInteger value = a.value() != null ? a.value() : BigInteger.ZERO;
                String calldata = a.calldata() != null ? a.calldata() : "[]";
                ActionCall call = targetRegistry.validate(properties.getTimelock().getPrincipal(),
                    a.target(), value, a.signature(), calldata);
                actions.add(new ProposalAction(a.target(), value, call.signature().canonical(),
                    targetRegistry.canonicalCalldata(call)));
            }
        }
        Proposal proposal = proposalStore.propose(proposer, actions, req.description());
        return toResponse(proposal, clock.instant());
    }

    @Transactional
    public VoteResponse vote(String voter, Long proposalId, boolean support) {
        return toResponse(proposalStore.castVote(voter, proposalId, support));
    }

    /** Pushes every action of a succeeded proposal into the timelock with {@code eta = now + min-delay}. */
    @Transactional
    public ProposalResponse queue(String caller, Long proposalId) {
        Proposal proposal = proposalStore.lockProposal(proposalId);
        Instant now = clock.instant();
        ProposalState state = proposalStore.stateOf(proposal, now);
        if (state != ProposalState.SUCCEEDED) {
            throw new GovernanceException(ErrorCode.INVALID_PROPOSAL_STATE,
                "Proposal " + proposalId + " is " + state + ", only SUCCEEDED proposals can be queued");
        }

        Instant eta = now.plus(properties.getTimelock().getMinDelay());
        for (ProposalAction action : proposal.getActions()) {
            timelockQueue.queueEntry(orchestrator(), action.getTarget(), action.getValue(),
                action.getSignature(), action.getCalldata(), eta, proposalId);
        }
        proposal.setEta(eta);

        log.info("Proposal queued: id={} eta={} entries={} by={}", proposalId, eta, proposal.getActions().size(), caller);
        eventLog.record("proposal_queued", caller, ProposalStore.subject(proposalId), Map.of("eta", eta.toString()));
        return toResponse(proposal, now);
    }

    /**
     * Executes every entry of a queued proposal in one transaction. Any failing
     * entry rolls all of them back and the proposal stays QUEUED.
     */
    @Transactional
    public ProposalResponse execute(String caller, Long proposalId) {
        Proposal proposal = proposalStore.lockProposal(proposalId);
        Instant now = clock.instant();
        ProposalState state = proposalStore.stateOf(proposal, now);
        if (state == ProposalState.EXPIRED) {
            throw new GovernanceException(ErrorCode.STALE_TRANSACTION,
                "Proposal " + proposalId + " expired at " + proposal.getEta().plus(properties.getTimelock().getGracePeriod()));
        }
        if (state != ProposalState.QUEUED) {
            throw new GovernanceException(ErrorCode.INVALID_PROPOSAL_STATE,
                "Proposal " + proposalId + " is " + state + ", only QUEUED proposals can be executed");
        }
        if (now.isBefore(proposal.getEta())) {
            throw new GovernanceException(ErrorCode.NOT_READY,
                "Proposal " + proposalId + " cannot execute before " + proposal.getEta());
        }

        for (ProposalAction action : proposal.getActions()) {
            String hash = ContentHash.of(action.getTarget(), action.getValue(), action.getSignature(),
                action.getCalldata(), proposal.getEta());
            timelockQueue.executeEntry(orchestrator(), hash);
        }
        proposal.setExecuted(true);

        log.info("Proposal executed: id={} entries={} by={}", proposalId, proposal.getActions().size(), caller);
        eventLog.record("proposal_executed", caller, ProposalStore.subject(proposalId),
            Map.of("entries", proposal.getActions().size()));
        return toResponse(proposal, now);
    }

    /**
     * Cancels any proposal that has not executed. The proposer may always cancel;
     * anyone else only once the proposer's voting power fell below the threshold.
     */
    @Transactional
    public ProposalResponse cancel(String caller, Long proposalId) {
        Proposal proposal = proposalStore.lockProposal(proposalId);
        Instant now = clock.instant();
        ProposalState state = proposalStore.stateOf(proposal, now);
        if (state == ProposalState.EXECUTED || state == ProposalState.CANCELED) {
            throw new GovernanceException(ErrorCode.INVALID_PROPOSAL_STATE,
                "Proposal " + proposalId + " is " + state + " and cannot be canceled");
        }
        BigInteger proposerPower = votingPowerLedger.votingPowerOf(proposal.getProposer());
        boolean byProposer = caller.equals(proposal.getProposer());
        boolean proposerLostStanding = proposerPower.compareTo(properties.getVoting().proposalThresholdPower()) < 0;
        if (!byProposer && !proposerLostStanding) {
            throw new GovernanceException(ErrorCode.CANCEL_NOT_ALLOWED,
                "Only the proposer may cancel while their voting power is at or above the threshold");
        }

        // once the admin role has moved on, the entries are the current admin's to cancel
        List<TimelockEntry> queued = entryRepository.findByProposalIdAndStatus(proposalId, EntryStatus.QUEUED);
        boolean holdsAdmin = orchestrator().equals(timelockQueue.admin().admin());
        if (holdsAdmin) {
            for (TimelockEntry entry : queued) {
                timelockQueue.cancelEntry(orchestrator(), entry.getHash());
            }
        } else if (!queued.isEmpty()) {
            log.warn("Proposal {} canceled without its {} timelock entries: orchestrator is not the timelock admin",
                proposalId, queued.size());
        }
        proposal.setCanceled(true);

        log.info("Proposal canceled: id={} by={} previousState={} entriesCanceled={}",
            proposalId, caller, state, holdsAdmin ? queued.size() : 0);
        eventLog.record("proposal_canceled", caller, ProposalStore.subject(proposalId),
            Map.of("previousState", state.name(), "proposerPower", proposerPower.toString()));
        return toResponse(proposal, now);
    }

    /** Accepts a pending timelock admin nomination as the orchestrator itself. */
    @Transactional
    public AdminResponse acceptTimelockAdmin() {
        return timelockQueue.acceptAdmin(orchestrator());
    }

    @Transactional
    public ProposalResponse get(Long proposalId) {
        return toResponse(proposalStore.find(proposalId), clock.instant());
    }

    @Transactional
    public ProposalPage page(Integer page, Integer size) {
        long total = proposalStore.proposalCount();
        Pagination pagination = Pagination.of(total,
            page != null ? page : 0,
            size != null ? size : Pagination.DEFAULT_SIZE);
        Instant now = clock.instant();
        List<ProposalResponse> items = proposalStore.page(pagination).stream()
            .map(p -> toResponse(p, now))
            .toList();
        return new ProposalPage(pagination.page(), pagination.pages(), total, items);
    }

    @Transactional
    public List<VoteResponse> votes(Long proposalId) {
        return proposalStore.votes(proposalId).stream().map(this::toResponse).toList();
    }

    @Transactional
    public List<TimelockEntryResponse> entries(Long proposalId) {
        proposalStore.find(proposalId);
        return timelockQueue.entriesForProposal(proposalId);
    }

    @Transactional
    public VoteResponse receipt(Long proposalId, String voter) {
        return toResponse(proposalStore.receipt(proposalId, voter));
    }

    @Transactional
    public GovernanceParametersResponse parameters() {
        GovernanceProperties.Voting voting = properties.getVoting();
        GovernanceProperties.Timelock timelock = properties.getTimelock();
        return new GovernanceParametersResponse(
            properties.getOrchestratorPrincipal(),
            timelock.getPrincipal(),
            voting.proposalThresholdPower(),
            voting.minimumLockAmount(),
            voting.getMinLockAge(),
            voting.getVotingDelay(),
            voting.getVotingPeriod(),
            voting.getQuorumBasisPoints(),
            voting.getMaxActions(),
            timelock.getMinDelay(),
            timelock.getGracePeriod(),
            votingPowerLedger.totalLocked(),
            proposalStore.quorum(),
            proposalStore.proposalCount(),
            targetRegistry.names()
        );
    }

    private String orchestrator() {
        return properties.getOrchestratorPrincipal();
    }

    private ProposalResponse toResponse(Proposal p, Instant now) {
        return new ProposalResponse(
            p.getId(),
            p.getProposer(),
            p.getDescription(),
            proposalStore.stateOf(p, now).name(),
            p.getActions().stream()
                .map(a -> new ActionResponse(a.getTarget(), a.getValue(), a.getSignature(), a.getCalldata()))
                .toList(),
            p.getForVotes(),
            p.getAgainstVotes(),
            proposalStore.quorum(),
            p.getVotingStartsAt(),
            p.getVotingEndsAt(),
            p.getEta(),
            p.getCreatedAt()
        );
    }

    private VoteResponse toResponse(ProposalVote v) {
        return new VoteResponse(v.getProposalId(), v.getVoter(), v.isSupport(), v.getWeight(), v.getCastAt());
    }
}
