package com.equorum.governance.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunable governance parameters, bound from {@code governance.*}.
 *
 * <pre>
 * governance:
 *   orchestrator-principal: governance
 *   voting:
 *     proposal-threshold: 100        # voting power, i.e. sqrt(locked)
 *     minimum-lock: 100              # token minor units
 *     quorum-basis-points: 400
 *   timelock:
 *     min-delay: 48h
 *     grace-period: 168h
 * </pre>
 */
@ConfigurationProperties("governance")
public class GovernanceProperties {

    /** Identity the orchestrator uses toward the timelock; also holds locked tokens in custody. */
    @NotBlank
    private String orchestratorPrincipal = "governance";

    private Voting voting = new Voting();

    private Timelock timelock = new Timelock();

    public String getOrchestratorPrincipal() { return orchestratorPrincipal; }
    public void setOrchestratorPrincipal(String orchestratorPrincipal) { this.orchestratorPrincipal = orchestratorPrincipal; }

    public Voting getVoting() { return voting; }
    public void setVoting(Voting voting) { this.voting = voting; }

    public Timelock getTimelock() { return timelock; }
    public void setTimelock(Timelock timelock) { this.timelock = timelock; }

    @ConfigurationProperties("voting")
    public static class Voting {

        @Min(1)
        private long proposalThreshold = 100;

        @Min(1)
        private long minimumLock = 100;

        @NotNull
        private Duration minLockAge = Duration.ofDays(7);

        @NotNull
        private Duration votingDelay = Duration.ZERO;

        @NotNull
        private Duration votingPeriod = Duration.ofDays(7);

        @Min(1)
        @Max(10_000)
        private int quorumBasisPoints = 400;

        @Min(1)
        private int maxActions = 10;

        private List<String> excludedPrincipals = new ArrayList<>();

        public BigInteger proposalThresholdPower() { return BigInteger.valueOf(proposalThreshold); }
        public BigInteger minimumLockAmount() { return BigInteger.valueOf(minimumLock); }

        public long getProposalThreshold() { return proposalThreshold; }
        public void setProposalThreshold(long proposalThreshold) { this.proposalThreshold = proposalThreshold; }

        public long getMinimumLock() { return minimumLock; }
        public void setMinimumLock(long minimumLock) { this.minimumLock = minimumLock; }

        public Duration getMinLockAge() { return minLockAge; }
        public void setMinLockAge(Duration minLockAge) { this.minLockAge = minLockAge; }

        public Duration getVotingDelay() { return votingDelay; }
        public void setVotingDelay(Duration votingDelay) { this.votingDelay = votingDelay; }

        public Duration getVotingPeriod() { return votingPeriod; }
        public void setVotingPeriod(Duration votingPeriod) { this.votingPeriod = votingPeriod; }

        public int getQuorumBasisPoints() { return quorumBasisPoints; }
        public void setQuorumBasisPoints(int quorumBasisPoints) { this.quorumBasisPoints = quorumBasisPoints; }

        public int getMaxActions() { return maxActions; }
        public void setMaxActions(int maxActions) { this.maxActions = maxActions; }

        public List<String> getExcludedPrincipals() { return excludedPrincipals; }
        public void setExcludedPrincipals(List<String> excludedPrincipals) { this.excludedPrincipals = excludedPrincipals; }
    }

    @ConfigurationProperties("timelock")
    public static class Timelock {

        /** The timelock's own identity, used as caller for queued self-calls. */
        @NotBlank
        private String principal = "timelock";

        /** Admin seeded on first use; normally handed over to the orchestrator afterwards. */
        @NotBlank
        private String initialAdmin = "deployer";

        @NotNull
        private Duration minDelay = Duration.ofHours(48);

        @NotNull
        private Duration gracePeriod = Duration.ofDays(7);

        public String getPrincipal() { return principal; }
        public void setPrincipal(String principal) { this.principal = principal; }

        public String getInitialAdmin() { return initialAdmin; }
        public void setInitialAdmin(String initialAdmin) { this.initialAdmin = initialAdmin; }

        public Duration getMinDelay() { return minDelay; }
        public void setMinDelay(Duration minDelay) { this.minDelay = minDelay; }

        public Duration getGracePeriod() { return gracePeriod; }
        public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
    }
}
