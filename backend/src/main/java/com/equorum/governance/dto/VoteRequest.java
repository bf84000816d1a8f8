package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Serdeable
@Schema(description = "Vote on an active proposal")
public record VoteRequest(
    @NotNull
    @Schema(description = "true = for, false = against")
    Boolean support
) {}
