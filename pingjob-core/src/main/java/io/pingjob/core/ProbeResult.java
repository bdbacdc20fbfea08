package io.pingjob.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Outcome of a single probe. {@code statusCode} is -1 when no response was received.
 */
public record ProbeResult(
        int statusCode,
        JsonNode body,
        Duration duration,
        Throwable failure
) {

    public static ProbeResult failed(Throwable failure, Duration duration) {
        return new ProbeResult(-1, null, duration, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
