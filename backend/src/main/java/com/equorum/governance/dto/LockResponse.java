package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.math.BigInteger;
import java.time.Instant;

@Serdeable
@Schema(description = "Locked balance and derived voting power of a principal")
public record LockResponse(
    String principal,
    BigInteger amount,
    @Schema(description = "floor(sqrt(amount))")
    BigInteger votingPower,
    @Nullable Instant lockedAt,
    @Nullable Instant updatedAt,
    @Nullable
    @Schema(description = "Unlock is refused before this instant")
    Instant committedUntil
) {}
