package com.equorum.governance.controller;

import com.equorum.governance.dto.CollaboratorParameterResponse;
import com.equorum.governance.target.CollaboratorTarget;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.exceptions.HttpStatusException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.inject.Inject;

import java.util.List;

@Controller("/api/v1/collaborators")
@Tag(name = "collaborators")
public class CollaboratorController {

    @Inject List<CollaboratorTarget> collaborators;

    @Get("/{name}/parameters")
    @Operation(summary = "Parameters written to a collaborator by executed proposals")
    public HttpResponse<List<CollaboratorParameterResponse>> parameters(String name) {
        CollaboratorTarget collaborator = collaborators.stream()
            .filter(c -> c.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new HttpStatusException(HttpStatus.NOT_FOUND, "Unknown collaborator: " + name));
        return HttpResponse.ok(collaborator.parameters());
    }
}
