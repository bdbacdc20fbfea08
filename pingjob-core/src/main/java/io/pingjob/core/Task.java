package io.pingjob.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Objects;

/**
 * HTTP probe executed on every firing of a job.
 *
 * @param url              target endpoint, requested with GET
 * @param timeout          bound on a single probe; null falls back to the executor default
 * @param authHeader       optional authorization header
 * @param expectedResponse reserved, not used when executing
 */
public record Task(
        String url,
        Duration timeout,
        AuthHeader authHeader,
        JsonNode expectedResponse
) {
    public Task {
        Objects.requireNonNull(url, "url must not be null");
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        if (expectedResponse != null && expectedResponse.isNull()) {
            expectedResponse = null;
        }
    }

    public static Task of(String url, Duration timeout) {
        return new Task(url, timeout, null, null);
    }

    public static Task of(String url, Duration timeout, AuthHeader authHeader) {
        return new Task(url, timeout, authHeader, null);
    }

    public AuthHeader authHeaderOrNone() {
        return authHeader == null ? AuthHeader.none() : authHeader;
    }
}
