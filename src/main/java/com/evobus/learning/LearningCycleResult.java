package com.evobus.learning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record LearningCycleResult(
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("evaluated") int evaluated,
    @JsonProperty("below_sample_threshold") int belowSampleThreshold,
    @JsonProperty("suppressed") int suppressed,
    @JsonProperty("published") List<ScoreUpdateEvent> published,
    @JsonProperty("undelivered") int undelivered
) {
}
