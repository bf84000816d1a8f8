package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

@Serdeable
@Schema(description = "Proposal with its derived state")
public record ProposalResponse(
    Long id,
    String proposer,
    String description,
    @Schema(allowableValues = {"PENDING", "ACTIVE", "SUCCEEDED", "DEFEATED", "QUEUED", "EXECUTED", "CANCELED", "EXPIRED"})
    String state,
    List<ActionResponse> actions,
    BigInteger forVotes,
    BigInteger againstVotes,
    @Schema(description = "Live quorum in voting-power units")
    BigInteger quorum,
    Instant votingStartsAt,
    Instant votingEndsAt,
    @Nullable Instant eta,
    Instant createdAt
) {}
