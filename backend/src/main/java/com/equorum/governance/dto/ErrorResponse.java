package com.equorum.governance.dto;

import com.equorum.governance.error.ErrorCode;
import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.annotation.Nullable;

@Serdeable
@Schema(description = "Error response")
public record ErrorResponse(
    String message,
    @Nullable String code,
    @Nullable
    @Schema(allowableValues = {"INPUT_VALIDATION", "AUTHORIZATION_DENIED", "STATE_CONFLICT", "TIMING_VIOLATION"})
    String category,
    @Nullable
    @Schema(description = "True when the same request may succeed later without any state change")
    Boolean retryable
) {
    public static ErrorResponse of(ErrorCode code, String message) {
        return new ErrorResponse(message, code.name(), code.getCategory().name(), code.isRetryable());
    }
}
