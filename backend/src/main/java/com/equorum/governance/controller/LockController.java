package com.equorum.governance.controller;

import com.equorum.governance.dto.LockRequest;
import com.equorum.governance.dto.LockResponse;
import com.equorum.governance.service.Principals;
import com.equorum.governance.service.VotingPowerLedger;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.*;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

@Controller("/api/v1/locks")
@Validated
@Tag(name = "locks")
public class LockController {

    @Inject VotingPowerLedger votingPowerLedger;
    @Inject Principals principals;

    @Post
    @Operation(summary = "Lock tokens into governance custody (adds to an existing lock)")
    public HttpResponse<LockResponse> lock(@Nullable @Header("X-Principal") String principal,
                                           @Valid @Body LockRequest req) {
        return HttpResponse.ok(votingPowerLedger.lock(principals.external(principal), req.amount()));
    }

    @Delete
    @Operation(summary = "Release the whole lock once no open proposal commits it")
    public HttpResponse<LockResponse> unlock(@Nullable @Header("X-Principal") String principal) {
        return HttpResponse.ok(votingPowerLedger.unlock(principals.external(principal)));
    }

    @Get("/{principal}")
    @Operation(summary = "Locked amount and voting power of a principal")
    public HttpResponse<LockResponse> get(String principal) {
        return HttpResponse.ok(votingPowerLedger.lockOf(principal));
    }
}
