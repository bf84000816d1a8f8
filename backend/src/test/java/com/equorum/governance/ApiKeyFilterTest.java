package com.equorum.governance;

import com.equorum.governance.dto.GovernanceParametersResponse;
import io.micronaut.context.annotation.Property;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.client.HttpClient;
import io.micronaut.http.client.annotation.Client;
import io.micronaut.http.client.exceptions.HttpClientResponseException;
import io.micronaut.test.extensions.junit5.annotation.MicronautTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@MicronautTest
@Property(name = "app.api-key", value = "s3cret")
class ApiKeyFilterTest {

    private static final String API_KEY_HEADER = "X-EQM-API-Key";

    @Inject
    @Client("/")
    HttpClient client;

    @Test
    void missingKey_returns401() {
        assertThatThrownBy(() -> client.toBlocking().exchange(
            HttpRequest.GET("/api/v1/governance/parameters"), GovernanceParametersResponse.class))
            .isInstanceOfSatisfying(HttpClientResponseException.class, ex ->
                assertThat((Object) ex.getStatus()).isEqualTo(HttpStatus.UNAUTHORIZED));
    }

    @Test
    void wrongKey_returns401() {
        assertThatThrownBy(() -> client.toBlocking().exchange(
            HttpRequest.GET("/api/v1/governance/parameters").header(API_KEY_HEADER, "guess"),
            GovernanceParametersResponse.class))
            .isInstanceOfSatisfying(HttpClientResponseException.class, ex ->
                assertThat((Object) ex.getStatus()).isEqualTo(HttpStatus.UNAUTHORIZED));
    }

    @Test
    void validKey_passesThrough() {
        HttpResponse<GovernanceParametersResponse> resp = client.toBlocking().exchange(
            HttpRequest.GET("/api/v1/governance/parameters").header(API_KEY_HEADER, "s3cret"),
            GovernanceParametersResponse.class);

        assertThat((Object) resp.getStatus()).isEqualTo(HttpStatus.OK);
        assertThat(resp.body().orchestratorPrincipal()).isEqualTo("governance");
    }
}
