package com.equorum.governance.dto;

import io.micronaut.serde.annotation.Serdeable;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Serdeable
@Schema(description = "One page of proposals, newest first")
public record ProposalPage(
    int page,
    int pages,
    long total,
    List<ProposalResponse> items
) {}
