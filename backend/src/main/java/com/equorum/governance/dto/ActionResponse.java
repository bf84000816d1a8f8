package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;

import java.math.BigInteger;

@Serdeable
public record ActionResponse(String target, BigInteger value, String signature, String calldata) {}
