package com.equorum.governance.infra;

import io.micronaut.context.annotation.Value;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MutableHttpResponse;
import io.micronaut.http.annotation.Filter;
import io.micronaut.http.filter.HttpServerFilter;
import io.micronaut.http.filter.ServerFilterChain;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Optional shared-secret guard in front of the governance API.
 *
 * Header: X-EQM-API-Key: {app.api-key}. A blank key turns the check off,
 * which is how tests and local runs use it. Caller identity itself travels
 * separately in X-Principal.
 */
@Filter("/api/v1/**")
public class ApiKeyFilter implements HttpServerFilter {

    static final String HEADER = "X-EQM-API-Key";

    @Value("${app.api-key:}")
    String configuredKey;

    @Override
    public Publisher<MutableHttpResponse<?>> doFilter(HttpRequest<?> request,
                                                       ServerFilterChain chain) {
        if (configuredKey == null || configuredKey.isBlank()) {
            return chain.proceed(request);
        }

        String provided = request.getHeaders().get(HEADER);
        if (configuredKey.equals(provided)) {
            return chain.proceed(request);
        }

        return Mono.just(HttpResponse.unauthorized()
            .body(Map.of("message", "Missing or invalid " + HEADER + " header")));
    }
}
