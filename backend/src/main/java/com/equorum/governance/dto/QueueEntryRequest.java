package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.time.Instant;

@Serdeable
@Schema(description = "Request to queue a delayed call on the timelock")
public record QueueEntryRequest(
    @Nullable String target,
    @Nullable BigInteger value,
    @Nullable String signature,
    @Nullable String calldata,

    @NotNull
    @Schema(description = "Earliest execution time")
    Instant eta
) {}
