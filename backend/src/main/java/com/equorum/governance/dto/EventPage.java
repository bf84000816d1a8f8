package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

import java.util.List;

@Serdeable
@Schema(description = "Cursor-paginated audit events, newest first")
public record EventPage(
    List<EventResponse> events,
    @Nullable String nextCursor,
    boolean hasMore
) {}
