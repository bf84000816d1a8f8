package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.time.Instant;
import java.util.Map;

@Serdeable
@Schema(description = "Audit log entry")
public record EventResponse(
    Long id,
    String type,
    @Nullable String actor,
    @Nullable String subject,
    Map<String, Object> payload,
    Instant createdAt
) {}
