package com.example.hubsyncservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Network or API-level failure from the upstream issue tracker (HTTP 502 when it reaches a
 * caller).
 */
public class UpstreamApiException extends BaseException {

    public UpstreamApiException(String message) {
        super("UPSTREAM_API_ERROR", message, HttpStatus.BAD_GATEWAY);
    }

    public UpstreamApiException(String message, Throwable cause) {
        super("UPSTREAM_API_ERROR", message, HttpStatus.BAD_GATEWAY, cause);
    }

    public static UpstreamApiException httpStatus(int status, String body) {
        return new UpstreamApiException("Linear API " + status + ": " + body);
    }

    public static UpstreamApiException graphQl(String messages) {
        return new UpstreamApiException("GraphQL: " + messages);
    }

    public static UpstreamApiException noData() {
        return new UpstreamApiException("No data returned from Linear API");
    }

    public static UpstreamApiException mutationFailed(String mutation) {
        return new UpstreamApiException("Linear mutation " + mutation + " did not succeed");
    }
}
