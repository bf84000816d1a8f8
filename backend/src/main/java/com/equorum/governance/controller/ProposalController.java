package com.equorum.governance.controller;

import com.equorum.governance.dto.CreateProposalRequest;
import com.equorum.governance.dto.ProposalPage;
import com.equorum.governance.dto.ProposalResponse;
import com.equorum.governance.dto.TimelockEntryResponse;
import com.equorum.governance.dto.VoteRequest;
import com.equorum.governance.dto.VoteResponse;
import com.equorum.governance.service.GovernanceOrchestrator;
import com.equorum.governance.service.Principals;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.*;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

import java.util.List;

@Controller("/api/v1/proposals")
@Validated
@Tag(name = "proposals")
public class ProposalController {

    @Inject GovernanceOrchestrator orchestrator;
    @Inject Principals principals;

    @Post
    @Operation(summary = "Open a proposal (requires voting power at or above the proposal threshold)")
    public HttpResponse<ProposalResponse> propose(@Nullable @Header("X-Principal") String principal,
                                                  @Valid @Body CreateProposalRequest req) {
        return HttpResponse.status(HttpStatus.CREATED).body(orchestrator.propose(principals.external(principal), req));
    }

    @Get
    @Operation(summary = "List proposals, newest first")
    public HttpResponse<ProposalPage> list(@Nullable @QueryValue Integer page, @Nullable @QueryValue Integer size) {
        return HttpResponse.ok(orchestrator.page(page, size));
    }

    @Get("/{id}")
    @Operation(summary = "Get a proposal with its derived state")
    public HttpResponse<ProposalResponse> get(Long id) {
        return HttpResponse.ok(orchestrator.get(id));
    }

    @Get("/{id}/votes")
    @Operation(summary = "List the votes cast on a proposal")
    public HttpResponse<List<VoteResponse>> votes(Long id) {
        return HttpResponse.ok(orchestrator.votes(id));
    }

    @Get("/{id}/votes/{voter}")
    @Operation(summary = "Get one principal's vote receipt")
    public HttpResponse<VoteResponse> receipt(Long id, String voter) {
        return HttpResponse.ok(orchestrator.receipt(id, voter));
    }

    @Get("/{id}/entries")
    @Operation(summary = "Timelock entries created when the proposal was queued")
    public HttpResponse<List<TimelockEntryResponse>> entries(Long id) {
        return HttpResponse.ok(orchestrator.entries(id));
    }

    @Post("/{id}/votes")
    @Operation(summary = "Vote on an active proposal with the caller's current voting power")
    public HttpResponse<VoteResponse> vote(@Nullable @Header("X-Principal") String principal,
                                           Long id, @Valid @Body VoteRequest req) {
        return HttpResponse.ok(orchestrator.vote(principals.external(principal), id, req.support()));
    }

    @Post("/{id}/queue")
    @Operation(summary = "Queue a succeeded proposal in the timelock")
    public HttpResponse<ProposalResponse> queue(@Nullable @Header("X-Principal") String principal, Long id) {
        return HttpResponse.ok(orchestrator.queue(principals.external(principal), id));
    }

    @Post("/{id}/execute")
    @Operation(summary = "Execute a queued proposal once its eta has passed")
    public HttpResponse<ProposalResponse> execute(@Nullable @Header("X-Principal") String principal, Long id) {
        return HttpResponse.ok(orchestrator.execute(principals.external(principal), id));
    }

    @Post("/{id}/cancel")
    @Operation(summary = "Cancel a proposal that has not executed")
    public HttpResponse<ProposalResponse> cancel(@Nullable @Header("X-Principal") String principal, Long id) {
        return HttpResponse.ok(orchestrator.cancel(principals.external(principal), id));
    }
}
