package com.equorum.governance.controller;

import com.equorum.governance.dto.EventPage;
import com.equorum.governance.service.EventLogService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.annotation.Nullable;
import jakarta.inject.Inject;

@Controller("/api/v1/events")
@Tag(name = "events")
public class EventController {

    @Inject EventLogService eventLog;

    @Get
    @Operation(summary = "List governance events (cursor-paginated, newest first)")
    public HttpResponse<EventPage> list(
            @Nullable @QueryValue String cursor,
            @Nullable @QueryValue Integer limit,
            @Nullable @QueryValue String type) {
        return HttpResponse.ok(eventLog.list(cursor, limit, type));
    }
}
