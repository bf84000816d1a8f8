package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

@Serdeable
@Schema(description = "Effective governance configuration and live supply figures")
public record GovernanceParametersResponse(
    String orchestratorPrincipal,
    String timelockPrincipal,
    BigInteger proposalThreshold,
    BigInteger minimumLock,
    Duration minLockAge,
    Duration votingDelay,
    Duration votingPeriod,
    int quorumBasisPoints,
    int maxActions,
    Duration timelockMinDelay,
    Duration timelockGracePeriod,
    BigInteger totalLocked,
    BigInteger quorum,
    long proposalCount,
    List<String> targets
) {}
