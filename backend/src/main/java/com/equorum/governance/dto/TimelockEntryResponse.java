package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.math.BigInteger;
import java.time.Instant;

@Serdeable
@Schema(description = "Timelock entry with its derived state")
public record TimelockEntryResponse(
    String hash,
    String target,
    BigInteger value,
    String signature,
    String calldata,
    Instant eta,
    @Schema(allowableValues = {"QUEUED", "EXECUTED", "CANCELED", "EXPIRED"})
    String state,
    @Nullable Long proposalId,
    Instant queuedAt,
    @Nullable Instant executedAt,
    @Nullable Instant canceledAt
) {}
