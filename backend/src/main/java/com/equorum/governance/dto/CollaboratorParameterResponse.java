package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;

import java.math.BigInteger;
import java.time.Instant;

@Serdeable
public record CollaboratorParameterResponse(String collaborator, String name, BigInteger value, Instant updatedAt) {}
