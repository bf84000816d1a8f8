package com.equorum.governance.infra;

import com.equorum.governance.dto.ErrorResponse;
import com.equorum.governance.error.ErrorCode;
import io.micronaut.context.annotation.Replaces;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.exceptions.HttpStatusException;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import io.micronaut.http.server.exceptions.HttpStatusHandler;
import jakarta.inject.Singleton;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback for everything {@link GovernanceExceptionHandler} does not cover.
 * Also renders plain {@link HttpStatusException}s (404s, bad paging input) in
 * the same {@link ErrorResponse} shape.
 */
@Singleton
@Produces
@Replaces(HttpStatusHandler.class)
public class GlobalExceptionHandler
    implements ExceptionHandler<Exception, HttpResponse<ErrorResponse>> {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Override
    public HttpResponse<ErrorResponse> handle(HttpRequest request, Exception e) {
        if (e instanceof HttpStatusException hse) {
            return HttpResponse
                .status(hse.getStatus())
                .body(new ErrorResponse(hse.getMessage(), hse.getStatus().name(), null, null));
        }

        // Lost insert races and lock timeouts surface at flush or commit, outside the services
        if (causedByPersistence(e)) {
            log.warn("Concurrent write rejected on {} {}: {}", request.getMethod(), request.getPath(), e.getMessage());
            ErrorCode code = ErrorCode.CONCURRENT_MODIFICATION;
            return HttpResponse
                .status(code.getStatus())
                .body(ErrorResponse.of(code, "Concurrent modification, retry the request"));
        }

        log.error("Unhandled exception: {}", e.getMessage(), e);
        return HttpResponse
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("Internal server error", "INTERNAL_ERROR", null, null));
    }

    static boolean causedByPersistence(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof PersistenceException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
