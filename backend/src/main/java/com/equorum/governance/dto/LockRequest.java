package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.math.BigInteger;

@Serdeable
@Schema(description = "Request to lock tokens into governance custody")
public record LockRequest(
    @Nullable
    @Schema(description = "Amount in token minor units, added to any existing lock")
    BigInteger amount
) {}
