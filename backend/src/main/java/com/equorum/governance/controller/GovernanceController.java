package com.equorum.governance.controller;

import com.equorum.governance.dto.AdminResponse;
import com.equorum.governance.dto.GovernanceParametersResponse;
import com.equorum.governance.service.GovernanceOrchestrator;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Post;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;

@Controller("/api/v1/governance")
@Tag(name = "governance")
public class GovernanceController {

    @Inject GovernanceOrchestrator orchestrator;

    @Post("/accept-admin")
    @Operation(summary = "Make the orchestrator accept a pending timelock admin nomination")
    public HttpResponse<AdminResponse> acceptAdmin() {
        return HttpResponse.ok(orchestrator.acceptTimelockAdmin());
    }

    @Get("/parameters")
    @Operation(summary = "Effective configuration with live locked supply and quorum")
    public HttpResponse<GovernanceParametersResponse> parameters() {
        return HttpResponse.ok(orchestrator.parameters());
    }
}
