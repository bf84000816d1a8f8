package com.equorum.governance.infra;

import com.equorum.governance.dto.ErrorResponse;
import com.equorum.governance.error.GovernanceException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders rejected governance operations with their code, category and
 * retryable flag. Takes precedence over the built-in HttpStatusException handler.
 */
@Singleton
@Produces
public class GovernanceExceptionHandler
    implements ExceptionHandler<GovernanceException, HttpResponse<ErrorResponse>> {

    private static final Logger log = LoggerFactory.getLogger(GovernanceExceptionHandler.class);

    @Override
    public HttpResponse<ErrorResponse> handle(HttpRequest request, GovernanceException e) {
        log.debug("Rejected {} {}: code={} {}", request.getMethod(), request.getPath(), e.getCode(), e.getMessage());
        return HttpResponse
            .status(e.getStatus())
            .body(ErrorResponse.of(e.getCode(), e.getMessage()));
    }
}
