package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.util.List;

@Serdeable
@Schema(description = "Request to open a proposal")
public record CreateProposalRequest(
    @Nullable
    @Schema(description = "Ordered actions executed together once the proposal passes")
    List<ActionRequest> actions,

    @Nullable
    @Schema(description = "Free-text description")
    String description
) {}
