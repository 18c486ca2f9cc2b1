package com.example.hubsyncservice.client.external;

import com.example.hubsyncservice.exception.UpstreamApiException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinearGraphQlTransportTest {

    private static final String API_URL = "https://api.linear.test/graphql";

    @Test
    void testExecute_ReturnsDataAndSendsRawToken() {
        AtomicReference<ClientRequest> sent = new AtomicReference<>();
        LinearGraphQlTransport transport = transport(HttpStatus.OK,
                "{\"data\":{\"viewer\":{\"id\":\"u-1\"}}}", sent);

        JsonNode data = transport.execute("  lin_api_token ", "query { viewer { id } }", Map.of());

        assertThat(data.path("viewer").path("id").asText()).isEqualTo("u-1");
        assertThat(sent.get().headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("lin_api_token");
        assertThat(sent.get().url().toString()).isEqualTo(API_URL);
    }

    @Test
    void testExecute_GraphQlErrors_Thrown() {
        LinearGraphQlTransport transport = transport(HttpStatus.OK,
                "{\"errors\":[{\"message\":\"Entity not found\"}],\"data\":null}", new AtomicReference<>());

        assertThatThrownBy(() -> transport.execute("token", "query", Map.of()))
                .isInstanceOf(UpstreamApiException.class)
                .hasMessageContaining("Entity not found");
    }

    @Test
    void testExecute_ErrorStatus_Thrown() {
        LinearGraphQlTransport transport = transport(HttpStatus.UNAUTHORIZED,
                "{\"errors\":[{\"message\":\"Authentication required\"}]}", new AtomicReference<>());

        assertThatThrownBy(() -> transport.execute("token", "query", Map.of()))
                .isInstanceOf(UpstreamApiException.class)
                .hasMessageContaining("401");
    }

    @Test
    void testExecute_NoData_Thrown() {
        LinearGraphQlTransport transport = transport(HttpStatus.OK, "{}", new AtomicReference<>());

        assertThatThrownBy(() -> transport.execute("token", "query", null))
                .isInstanceOf(UpstreamApiException.class);
    }

    private static LinearGraphQlTransport transport(HttpStatus status, String body, AtomicReference<ClientRequest> sent) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    sent.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new LinearGraphQlTransport(webClient, API_URL, 5);
    }
}
