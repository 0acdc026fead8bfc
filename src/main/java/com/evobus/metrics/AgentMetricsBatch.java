package com.evobus.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One flush worth of metrics as sent to the agent-metrics queue: the raw entries plus a
 * per agent type summary.
 */
public record AgentMetricsBatch(
    @JsonProperty("instance_id") String instanceId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("metrics") List<MetricEntry> metrics,
    @JsonProperty("summaries") List<AgentSummary> summaries
) {

    public record AgentSummary(
        @JsonProperty("agent_type") String agentType,
        @JsonProperty("metrics") List<MetricSummary> metrics
    ) {}

    public record MetricSummary(
        @JsonProperty("name") String name,
        @JsonProperty("count") int count,
        @JsonProperty("avg") double avg,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max
    ) {}
}
