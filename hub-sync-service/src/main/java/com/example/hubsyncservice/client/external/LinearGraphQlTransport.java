package com.example.hubsyncservice.client.external;

import com.example.hubsyncservice.exception.UpstreamApiException;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.StreamSupport;
import java.util.stream.Collectors;

/**
 * Single GraphQL round trip against the Linear API.
 *
 * CRITICAL DESIGN:
 * - Must be called OUTSIDE @Transactional
 * - No retry and no fallback: every failure propagates as {@link UpstreamApiException}
 *   and the calling orchestrator decides how far it reaches
 * - Rate limited (resilience4j "linear") to stay inside the upstream quota
 */
@Component
@Slf4j
public class LinearGraphQlTransport {

    private final WebClient linearWebClient;
    private final String apiUrl;
    private final Duration timeout;

    public LinearGraphQlTransport(@Qualifier("linearWebClient") WebClient linearWebClient,
                                  @Value("${linear.api.url:https://api.linear.app/graphql}") String apiUrl,
                                  @Value("${linear.api.timeout-seconds:30}") long timeoutSeconds) {
        this.linearWebClient = linearWebClient;
        this.apiUrl = apiUrl;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * Execute a query or mutation and return its {@code data} object.
     *
     * @param token workspace API token, sent as the raw Authorization header
     * @throws UpstreamApiException on transport errors, non-2xx status, GraphQL errors or a
     *                              response without data
     */
    @RateLimiter(name = "linear")
    public JsonNode execute(String token, String query, Map<String, Object> variables) {
        Map<String, Object> body = new HashMap<>();
        body.put("query", query);
        body.put("variables", variables == null ? Map.of() : variables);

        JsonNode response;
        try {
            response = linearWebClient.post()
                    .uri(apiUrl)
                    .header(HttpHeaders.AUTHORIZATION, token.trim())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(text -> {
                                log.warn("Linear API error status={}", clientResponse.statusCode().value());
                                return Mono.error(UpstreamApiException.httpStatus(
                                        clientResponse.statusCode().value(), text));
                            }))
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (UpstreamApiException e) {
            throw e;
        } catch (Exception e) {
            log.error("Linear request failed: {}", e.getMessage());
            throw new UpstreamApiException("Linear request failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw UpstreamApiException.noData();
        }

        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            String messages = StreamSupport.stream(errors.spliterator(), false)
                    .map(error -> error.path("message").asText("unknown error"))
                    .collect(Collectors.joining(", "));
            throw UpstreamApiException.graphQl(messages);
        }

        JsonNode data = response.path("data");
        if (data.isMissingNode() || data.isNull()) {
            throw UpstreamApiException.noData();
        }
        return data;
    }
}
