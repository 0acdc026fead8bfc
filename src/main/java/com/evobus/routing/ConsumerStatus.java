package com.evobus.routing;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ConsumerStatus(
    @JsonProperty("health") ConsumerHealth health,
    @JsonProperty("consecutive_errors") int consecutiveErrors,
    @JsonProperty("processed") long processed,
    @JsonProperty("succeeded") long succeeded,
    @JsonProperty("failed") long failed,
    @JsonProperty("duplicates") long duplicates,
    @JsonProperty("last_error") String lastError,
    @JsonProperty("backoff_until") Instant backoffUntil
) {
}
