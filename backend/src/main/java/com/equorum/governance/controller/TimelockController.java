package com.equorum.governance.controller;

import com.equorum.governance.dto.AdminResponse;
import com.equorum.governance.dto.ChangeAdminRequest;
import com.equorum.governance.dto.QueueEntryRequest;
import com.equorum.governance.dto.TimelockEntryResponse;
import com.equorum.governance.service.Principals;
import com.equorum.governance.service.TimelockQueue;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.*;
import io.micronaut.validation.Validated;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;
import jakarta.validation.Valid;

/**
 * Direct access to the timelock for its admin. Once the orchestrator holds
 * the admin role these mutations are only reachable through proposals.
 */
@Controller("/api/v1/timelock")
@Validated
@Tag(name = "timelock")
public class TimelockController {

    @Inject TimelockQueue timelockQueue;
    @Inject Principals principals;

    @Post("/entries")
    @Operation(summary = "Queue a delayed call (admin only)")
    public HttpResponse<TimelockEntryResponse> queue(@Nullable @Header("X-Principal") String principal,
                                                     @Valid @Body QueueEntryRequest req) {
        return HttpResponse.status(HttpStatus.CREATED).body(timelockQueue.queueEntry(
            principals.external(principal), req.target(), req.value(), req.signature(), req.calldata(), req.eta()));
    }

    @Get("/entries/{hash}")
    @Operation(summary = "Get a timelock entry with its derived state")
    public HttpResponse<TimelockEntryResponse> get(String hash) {
        return HttpResponse.ok(timelockQueue.entry(hash));
    }

    @Post("/entries/{hash}/execute")
    @Operation(summary = "Execute a ready entry (admin only)")
    public HttpResponse<TimelockEntryResponse> execute(@Nullable @Header("X-Principal") String principal, String hash) {
        return HttpResponse.ok(timelockQueue.executeEntry(principals.external(principal), hash));
    }

    @Post("/entries/{hash}/cancel")
    @Operation(summary = "Cancel a queued entry (admin only)")
    public HttpResponse<TimelockEntryResponse> cancel(@Nullable @Header("X-Principal") String principal, String hash) {
        return HttpResponse.ok(timelockQueue.cancelEntry(principals.external(principal), hash));
    }

    @Get("/admin")
    @Operation(summary = "Current and pending admin")
    public HttpResponse<AdminResponse> admin() {
        return HttpResponse.ok(timelockQueue.admin());
    }

    @Post("/admin/pending")
    @Operation(summary = "Nominate a new admin (admin only); the nominee must accept")
    public HttpResponse<AdminResponse> nominate(@Nullable @Header("X-Principal") String principal,
                                                @Valid @Body ChangeAdminRequest req) {
        return HttpResponse.ok(timelockQueue.changeAdmin(principals.external(principal), req.newAdmin()));
    }

    @Post("/admin/accept")
    @Operation(summary = "Accept a pending nomination as the caller")
    public HttpResponse<AdminResponse> accept(@Nullable @Header("X-Principal") String principal) {
        return HttpResponse.ok(timelockQueue.acceptAdmin(principals.external(principal)));
    }
}
