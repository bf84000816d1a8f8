package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.math.BigInteger;

@Serdeable
@Schema(description = "One action of a proposal")
public record ActionRequest(
    @Nullable
    @Schema(description = "Target identifier", example = "staking")
    String target,

    @Nullable
    @Schema(description = "Value attached to the call, minor units", defaultValue = "0")
    BigInteger value,

    @Nullable
    @Schema(description = "Function signature", example = "setParameter(string,uint256)")
    String signature,

    @Nullable
    @Schema(description = "Arguments as a JSON array of strings", example = "[\"baseApy\",\"500\"]")
    String calldata
) {}
