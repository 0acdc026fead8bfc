package com.evobus.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record MetricsStats(
    @JsonProperty("total_metrics_recorded") long totalMetricsRecorded,
    @JsonProperty("total_batches_sent") long totalBatchesSent,
    @JsonProperty("buffer_size") int bufferSize,
    @JsonProperty("dropped_metrics") long droppedMetrics,
    @JsonProperty("last_flush_at") Instant lastFlushAt
) {
}
