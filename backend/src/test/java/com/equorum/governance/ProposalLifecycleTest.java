package com.equorum.governance;

import com.equorum.governance.domain.ProposalState;
import com.equorum.governance.dto.ActionRequest;
import com.equorum.governance.dto.CreateProposalRequest;
import com.equorum.governance.dto.ErrorResponse;
import com.equorum.governance.dto.GovernanceParametersResponse;
import com.equorum.governance.dto.ProposalPage;
import com.equorum.governance.dto.ProposalResponse;
import com.equorum.governance.dto.VoteResponse;
import com.equorum.governance.ledger.TokenLedger;
import com.equorum.governance.service.ProposalStore;
import io.micronaut.context.annotation.Property;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.annotation.MockBean;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.equorum.governance.GovernanceApi.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@MicronautTest(transactional = false)
@Property(name = "governance.voting.quorum-basis-points", value = "1")
class ProposalLifecycleTest {

    @Inject
    @Client("/")
    HttpClient client;

    @Inject TokenLedger tokenLedger;
    @Inject MutableClock clock;
    @Inject ProposalStore proposalStore;

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

    private ProposalResponse openProposal(String proposer) {
        return api.propose(proposer, "Set staking APY", setParameter("staking", "baseApy", 500));
    }

    // ── Creation ──────────────────────────────────────────────────────────

    @Test
    void propose_returns201AndActiveProposal() {
        String alice = proposer();

        HttpResponse<ProposalResponse> resp = api.http().exchange(
            as(alice, HttpRequest.POST("/api/v1/proposals", new CreateProposalRequest(
                List.of(setParameter("staking", "maxApy", 900)), "Raise the APY ceiling"))),
            ProposalResponse.class);

        assertThat((Object) resp.getStatus()).isEqualTo(HttpStatus.CREATED);
        ProposalResponse body = resp.body();
        assertThat(body.id()).isNotNull();
        assertThat(body.proposer()).isEqualTo(alice);
        assertThat(body.state()).isEqualTo("ACTIVE");
        assertThat(proposalStore.state(body.id())).isEqualTo(ProposalState.ACTIVE);
        assertThat(body.forVotes()).isZero();
        assertThat(body.againstVotes()).isZero();
        assertThat(body.eta()).isNull();
        assertThat(body.votingStartsAt()).isEqualTo(clock.instant());
        assertThat(body.votingEndsAt()).isEqualTo(clock.instant().plus(Duration.ofDays(7)));
        assertThat(body.actions()).singleElement().satisfies(a -> {
            assertThat(a.target()).isEqualTo("staking");
            assertThat(a.signature()).isEqualTo("setParameter(string,uint256)");
            assertThat(a.calldata()).isEqualTo("[\"maxApy\",\"900\"]");
        });
    }

    @Test
    void propose_belowThreshold_returns403() {
        String small = principal("small");
        api.lock(small, 9_999);

        ErrorResponse err = error(() -> openProposal(small));

        assertThat(err.code()).isEqualTo("BELOW_THRESHOLD");
        assertThat(err.category()).isEqualTo("AUTHORIZATION_DENIED");
    }

    @Test
    void propose_withoutLock_belowThreshold() {
        assertRejected(() -> openProposal(principal("empty")), "BELOW_THRESHOLD");
    }

    @Test
    void propose_noActions_rejected() {
        String p = proposer();
        assertRejected(() -> api.propose(p, "Nothing to do"), "EMPTY_ACTIONS");
    }

    @Test
    void propose_tooManyActions_rejected() {
        String p = proposer();
        List<ActionRequest> actions = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            actions.add(setParameter("staking", "baseApy", i));
        }
        assertRejected(() -> api.propose(p, "Eleven steps", actions.toArray(new ActionRequest[0])), "TOO_MANY_ACTIONS");
    }

    @Test
    void propose_duplicateAction_rejected() {
        String p = proposer();
        ActionRequest action = setParameter("faucet", "dailyCap", 1_000);
        assertRejected(() -> api.propose(p, "Twice", action, action), "DUPLICATE_ACTION");
    }

    @Test
    void propose_sameActionWithReformattedCalldata_rejectedAsDuplicate() {
        String p = proposer();
        ActionRequest compact = action("faucet", "setParameter(string,uint256)", "[\"dailyCap\",\"2000\"]");
        ActionRequest spaced = action("faucet", "setParameter(string,uint256)", "[ \"dailyCap\", \"2000\" ]");
        assertRejected(() -> api.propose(p, "Twice, reformatted", compact, spaced), "DUPLICATE_ACTION");

        ProposalResponse proposal = api.propose(p, "Reformatted once", spaced);
        assertThat(proposal.actions()).singleElement().satisfies(a -> {
            assertThat(a.signature()).isEqualTo("setParameter(string,uint256)");
            assertThat(a.calldata()).isEqualTo("[\"dailyCap\",\"2000\"]");
        });
    }

    @Test
    void propose_blankDescription_rejected() {
        String p = proposer();
        assertRejected(() -> api.propose(p, "  ", setParameter("faucet", "dailyCap", 1)), "EMPTY_DESCRIPTION");
    }

    @Test
    void propose_unknownTarget_rejected() {
        String p = proposer();
        assertRejected(() -> api.propose(p, "Bad target",
            action("treasury", "setParameter(string,uint256)", "[\"x\",\"1\"]")), "INVALID_TARGET");
    }

    @Test
    void propose_unsupportedOrMalformedSignature_rejected() {
        String p = proposer();
        assertRejected(() -> api.propose(p, "Bad sig",
            action("staking", "setParameter(string", "[\"baseApy\",\"1\"]")), "INVALID_SIGNATURE");
        assertRejected(() -> api.propose(p, "Unsupported",
            action("staking", "withdraw(uint256)", "[\"1\"]")), "INVALID_SIGNATURE");
    }

    @Test
    void propose_calldataNotMatchingSignature_rejected() {
        String p = proposer();
        assertRejected(() -> api.propose(p, "Wrong arity",
            action("staking", "setParameter(string,uint256)", "[\"baseApy\"]")), "INVALID_CALLDATA");
        assertRejected(() -> api.propose(p, "Not a number",
            action("staking", "setParameter(string,uint256)", "[\"baseApy\",\"ten\"]")), "INVALID_CALLDATA");
        assertRejected(() -> api.propose(p, "Not json",
            action("staking", "setParameter(string,uint256)", "baseApy,10")), "INVALID_CALLDATA");
    }

    @Test
    void propose_commitsProposerLockUntilVotingEnds() {
        String p = proposer();
        ProposalResponse proposal = openProposal(p);

        assertThat(api.lockOf(p).committedUntil()).isEqualTo(proposal.votingEndsAt());
    }

    // ── Voting ────────────────────────────────────────────────────────────

    @Test
    void vote_recordsWeightAndReceipt() {
        ProposalResponse proposal = openProposal(proposer());
        String voter = principal("voter");
        api.lock(voter, 3_600);

        VoteResponse vote = api.vote(voter, proposal.id(), true);

        assertThat(vote.weight()).isEqualTo(BigInteger.valueOf(60));
        assertThat(vote.support()).isTrue();
        assertThat(api.proposal(proposal.id()).forVotes()).isEqualTo(BigInteger.valueOf(60));

        VoteResponse receipt = api.http().retrieve(
            HttpRequest.GET("/api/v1/proposals/" + proposal.id() + "/votes/" + voter), VoteResponse.class);
        assertThat(receipt.weight()).isEqualTo(BigInteger.valueOf(60));
        assertThat(api.votes(proposal.id())).extracting(VoteResponse::voter).containsExactly(voter);
    }

    @Test
    void vote_secondVote_rejectedAndTalliesUnchanged() {
        ProposalResponse proposal = openProposal(proposer());
        String voter = principal("twice");
        api.lock(voter, 2_500);
        api.vote(voter, proposal.id(), false);

        ErrorResponse err = error(() -> api.vote(voter, proposal.id(), true));

        assertThat(err.code()).isEqualTo("ALREADY_VOTED");
        ProposalResponse after = api.proposal(proposal.id());
        assertThat(after.forVotes()).isZero();
        assertThat(after.againstVotes()).isEqualTo(BigInteger.valueOf(50));
    }

    @Test
    void vote_withoutLockedTokens_rejected() {
        ProposalResponse proposal = openProposal(proposer());
        assertRejected(() -> api.vote(principal("broke"), proposal.id(), true), "NO_VOTING_POWER");
    }

    @Test
    void vote_afterWindow_rejectedAsVotingClosed() {
        ProposalResponse proposal = openProposal(proposer());
        String late = principal("late");
        api.lock(late, 400);
        clock.set(proposal.votingEndsAt().plusSeconds(1));

        ErrorResponse err = error(() -> api.vote(late, proposal.id(), true));

        assertThat(err.code()).isEqualTo("VOTING_CLOSED");
        assertThat(err.category()).isEqualTo("TIMING_VIOLATION");
    }

    @Test
    void vote_atLastInstantOfWindow_counts() {
        ProposalResponse proposal = openProposal(proposer());
        String voter = principal("lastcall");
        api.lock(voter, 400);
        clock.set(proposal.votingEndsAt());

        assertThat(api.vote(voter, proposal.id(), true).weight()).isEqualTo(BigInteger.valueOf(20));
    }

    @Test
    void vote_unknownProposal_returns404() {
        String voter = principal("lost");
        api.lock(voter, 400);

        ErrorResponse err = error(() -> api.vote(voter, 987_654L, true));

        assertThat(err.code()).isEqualTo("PROPOSAL_NOT_FOUND");
        assertThatThrownBy(() -> api.proposal(987_654L))
            .isInstanceOfSatisfying(HttpClientResponseException.class, ex ->
                assertThat((Object) ex.getStatus()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void receipt_forNonVoter_returns404() {
        ProposalResponse proposal = openProposal(proposer());

        assertThatThrownBy(() -> api.http().retrieve(
            HttpRequest.GET("/api/v1/proposals/" + proposal.id() + "/votes/" + principal("silent")), VoteResponse.class))
            .isInstanceOfSatisfying(HttpClientResponseException.class, ex ->
                assertThat((Object) ex.getStatus()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    // ── Outcome ───────────────────────────────────────────────────────────

    @Test
    void outcome_majorityFor_succeeds() {
        String p = proposer();
        ProposalResponse proposal = openProposal(p);
        api.vote(p, proposal.id(), true);

        clock.set(proposal.votingEndsAt().plusSeconds(1));

        assertThat(api.proposal(proposal.id()).state()).isEqualTo("SUCCEEDED");
    }

    @Test
    void outcome_tie_isDefeated() {
        String p = proposer();
        ProposalResponse proposal = openProposal(p);
        String opponent = principal("opponent");
        api.lock(opponent, 10_000);
        api.vote(p, proposal.id(), true);
        api.vote(opponent, proposal.id(), false);

        clock.set(proposal.votingEndsAt().plusSeconds(1));

        ProposalResponse after = api.proposal(proposal.id());
        assertThat(after.forVotes()).isEqualTo(after.againstVotes());
        assertThat(after.state()).isEqualTo("DEFEATED");
    }

    @Test
    void outcome_noVotes_isDefeated() {
        ProposalResponse proposal = openProposal(proposer());
        clock.set(proposal.votingEndsAt().plusSeconds(1));

        assertThat(api.proposal(proposal.id()).state()).isEqualTo("DEFEATED");
    }

    @Test
    void queue_activeOrDefeatedProposal_rejected() {
        String p = proposer();
        ProposalResponse active = openProposal(p);
        assertRejected(() -> api.queue(p, active.id()), "INVALID_PROPOSAL_STATE");

        clock.set(active.votingEndsAt().plusSeconds(1));
        assertRejected(() -> api.queue(p, active.id()), "INVALID_PROPOSAL_STATE");
    }

    @Test
    void execute_unqueuedProposal_rejected() {
        String p = proposer();
        ProposalResponse proposal = openProposal(p);
        assertRejected(() -> api.execute(p, proposal.id()), "INVALID_PROPOSAL_STATE");
    }

    // ── Listing ───────────────────────────────────────────────────────────

    @Test
    void list_newestFirstWithPages() {
        String p = proposer();
        ProposalResponse first = openProposal(p);
        ProposalResponse second = api.propose(p, "Faucet cap", setParameter("faucet", "dailyCap", 10));

        ProposalPage page = api.http().retrieve(HttpRequest.GET("/api/v1/proposals?page=0&size=2"), ProposalPage.class);

        assertThat(page.page()).isZero();
        assertThat(page.total()).isGreaterThanOrEqualTo(2);
        assertThat(page.pages()).isEqualTo((int) ((page.total() + 1) / 2));
        assertThat(page.items()).extracting(ProposalResponse::id).containsExactly(second.id(), first.id());
    }

    @Test
    void list_pageOutOfRange_returns400() {
        openProposal(proposer());

        assertThatThrownBy(() -> api.http().retrieve(HttpRequest.GET("/api/v1/proposals?page=5000&size=100"), ProposalPage.class))
            .isInstanceOfSatisfying(HttpClientResponseException.class, ex ->
                assertThat((Object) ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST));
        assertThatThrownBy(() -> api.http().retrieve(HttpRequest.GET("/api/v1/proposals?size=0"), ProposalPage.class))
            .isInstanceOfSatisfying(HttpClientResponseException.class, ex ->
                assertThat((Object) ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST));
    }

    @Test
    void parameters_reportEffectiveConfiguration() {
        GovernanceParametersResponse params = api.http().retrieve(
            HttpRequest.GET("/api/v1/governance/parameters"), GovernanceParametersResponse.class);

        assertThat(params.orchestratorPrincipal()).isEqualTo("governance");
        assertThat(params.timelockPrincipal()).isEqualTo("timelock");
        assertThat(params.proposalThreshold()).isEqualTo(BigInteger.valueOf(100));
        assertThat(params.quorumBasisPoints()).isEqualTo(1);
        assertThat(params.votingPeriod()).isEqualTo(Duration.ofDays(7));
        assertThat(params.timelockMinDelay()).isEqualTo(Duration.ofHours(48));
        assertThat(params.targets()).contains("faucet", "governance", "reserve", "staking", "timelock", "vesting");
    }
}
