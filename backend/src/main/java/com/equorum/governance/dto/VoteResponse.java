package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigInteger;
import java.time.Instant;

@Serdeable
@Schema(description = "Vote receipt")
public record VoteResponse(
    Long proposalId,
    String voter,
    boolean support,
    BigInteger weight,
    Instant castAt
) {}
