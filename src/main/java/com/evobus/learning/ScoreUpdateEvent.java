package com.evobus.learning;

import com.evobus.contract.ComplexityLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A learned routing score change for one (model, complexity) pair, broadcast to every
 * instance. Applying the same event twice leaves the same score.
 */
public record ScoreUpdateEvent(
    @JsonProperty("model") String model,
    @JsonProperty("complexity") ComplexityLevel complexity,
    @JsonProperty("old_score") double oldScore,
    @JsonProperty("new_score") double newScore,
    @JsonProperty("reason") String reason,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("based_on_samples") long basedOnSamples,
    @JsonProperty("timestamp") Instant timestamp
) {
}
