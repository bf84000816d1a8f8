package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

@Serdeable
@Schema(description = "Timelock admin role")
public record AdminResponse(
    String admin,
    @Nullable String pendingAdmin
) {}
