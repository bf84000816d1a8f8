package com.equorum.governance;

import com.equorum.governance.dto.ProposalResponse;
import com.equorum.governance.ledger.TokenLedger;
import com.equorum.governance.service.ContentHash;
import com.equorum.governance.service.TimelockQueue;
import io.micronaut.context.annotation.Property;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static com.equorum.governance.GovernanceApi.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@MicronautTest(transactional = false)
@Property(name = "governance.voting.quorum-basis-points", value = "1")
class ProposalCancellationTest {

    @Inject
    @Client("/")
    HttpClient client;

    @Inject TokenLedger tokenLedger;
    @Inject MutableClock clock;
    @Inject TimelockQueue timelockQueue;

    @MockBean(TokenLedger.class)
    TokenLedger mockLedger() {
        return mock(TokenLedger.class);
    }

    private GovernanceApi api;

    @BeforeEach
    void setup() {
        api = new GovernanceApi(client);
        when(tokenLedger.balanceOf(anyString())).thenReturn(BigInteger.valueOf(1_000_000_000L));
        when(tokenLedger.transferFrom(anyString(), anyString(), any())).thenReturn(true);
    }

    private String proposer() {
        String p = principal("proposer");
        api.lock(p, 10_000);
        return p;
    }

    private ProposalResponse propose(String proposer, long value) {
        return api.propose(proposer, "Vesting release " + value, setParameter("vesting", "monthlyRelease", value));
    }

    /** Votes the proposal through and queues it. */
    private ProposalResponse queued(String proposer, long value) {
        ProposalResponse proposal = propose(proposer, value);
        api.vote(proposer, proposal.id(), true);
        clock.set(proposal.votingEndsAt().plusSeconds(1));
        return api.queue(proposer, proposal.id());
    }

    @Test
    void proposer_cancelsActiveProposal() {
        String p = proposer();
        ProposalResponse proposal = propose(p, 1);

        ProposalResponse canceled = api.cancel(p, proposal.id());

        assertThat(canceled.state()).isEqualTo("CANCELED");
        String voter = principal("voter");
        api.lock(voter, 400);
        assertRejected(() -> api.vote(voter, proposal.id(), true), "VOTING_CLOSED");
    }

    @Test
    void proposer_cancelsDefeatedProposal() {
        String p = proposer();
        ProposalResponse proposal = propose(p, 2);
        clock.set(proposal.votingEndsAt().plusSeconds(1));
        assertThat(api.proposal(proposal.id()).state()).isEqualTo("DEFEATED");

        assertThat(api.cancel(p, proposal.id()).state()).isEqualTo("CANCELED");
    }

    @Test
    void stranger_cannotCancelWhileProposerHoldsThreshold() {
        String p = proposer();
        ProposalResponse proposal = propose(p, 3);

        assertRejected(() -> api.cancel(principal("stranger"), proposal.id()), "CANCEL_NOT_ALLOWED");
        assertThat(api.proposal(proposal.id()).state()).isEqualTo("ACTIVE");
    }

    @Test
    void stranger_cancelsQueuedProposalOnceProposerUnlocked() {
        String p = proposer();
        ProposalResponse proposal = queued(p, 4);
        String hash = ContentHash.of("vesting", BigInteger.ZERO, "setParameter(string,uint256)",
            "[\"monthlyRelease\",\"4\"]", proposal.eta());
        assertThat(api.entry(hash).state()).isEqualTo("QUEUED");

        api.unlock(p);
        ProposalResponse canceled = api.cancel(principal("stranger"), proposal.id());

        assertThat(canceled.state()).isEqualTo("CANCELED");
        assertThat(api.entry(hash).state()).isEqualTo("CANCELED");

        clock.set(proposal.eta());
        assertRejected(() -> api.execute(p, proposal.id()), "INVALID_PROPOSAL_STATE");
    }

    @Test
    void stranger_cancelsQueuedProposalAfterAdminLeftOrchestrator() {
        String p = proposer();
        ProposalResponse proposal = queued(p, 8);
        String hash = ContentHash.of("vesting", BigInteger.ZERO, "setParameter(string,uint256)",
            "[\"monthlyRelease\",\"8\"]", proposal.eta());
        timelockQueue.changeAdmin("governance", "multisig");
        timelockQueue.acceptAdmin("multisig");
        try {
            api.unlock(p);
            ProposalResponse canceled = api.cancel(principal("stranger"), proposal.id());

            assertThat(canceled.state()).isEqualTo("CANCELED");
            // the entry is now the multisig's to cancel
            assertThat(api.entry(hash).state()).isEqualTo("QUEUED");
            clock.set(proposal.eta());
            assertRejected(() -> api.execute(p, proposal.id()), "INVALID_PROPOSAL_STATE");
            assertThat(timelockQueue.cancelEntry("multisig", hash).state()).isEqualTo("CANCELED");
        } finally {
            timelockQueue.changeAdmin("multisig", "governance");
            timelockQueue.acceptAdmin("governance");
        }
    }

    @Test
    void proposer_cancelsExpiredQueuedProposal() {
        String p = proposer();
        ProposalResponse proposal = queued(p, 5);
        clock.set(proposal.eta().plus(Duration.ofDays(7)).plusSeconds(1));
        assertThat(api.proposal(proposal.id()).state()).isEqualTo("EXPIRED");
        assertRejected(() -> api.execute(p, proposal.id()), "STALE_TRANSACTION");

        assertThat(api.cancel(p, proposal.id()).state()).isEqualTo("CANCELED");
    }

    @Test
    void cancel_twiceOrAfterExecution_rejected() {
        String p = proposer();
        ProposalResponse first = propose(p, 6);
        api.cancel(p, first.id());
        assertRejected(() -> api.cancel(p, first.id()), "INVALID_PROPOSAL_STATE");

        ProposalResponse second = queued(p, 7);
        clock.set(second.eta());
        api.execute(p, second.id());
        assertRejected(() -> api.cancel(p, second.id()), "INVALID_PROPOSAL_STATE");
    }

    @Test
    void cancel_unknownProposal_notFound() {
        assertRejected(() -> api.cancel(principal("anyone"), 424_242L), "PROPOSAL_NOT_FOUND");
    }
}
