package com.evobus.routing;

import com.evobus.contract.ComplexityLevel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Running usage, success and latency statistics for one (model, complexity) pair.
 *
 * The average response time is maintained incrementally over the decisions that
 * reported a response time: {@code avg' = avg + (sample - avg) / samples}.
 */
public record AggregatedMetric(
    @JsonProperty("model_name") String modelName,
    @JsonProperty("complexity_level") ComplexityLevel complexityLevel,
    @JsonProperty("usage_count") long usageCount,
    @JsonProperty("success_count") long successCount,
    @JsonProperty("avg_response_time_ms") double avgResponseTimeMs,
    @JsonProperty("response_time_samples") long responseTimeSamples,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public static AggregatedMetric empty(AggregateKey key, Instant at) {
        return new AggregatedMetric(key.model(), key.complexity(), 0, 0, 0.0, 0, at, at);
    }

    /** Fold one decision into the aggregate and return the new row. */
    public AggregatedMetric record(RoutingDecisionRecord decision, Instant at) {
        long usage = usageCount + 1;
        long success = successCount + (decision.outcome().isSuccess() ? 1 : 0);
        double avg = avgResponseTimeMs;
        long samples = responseTimeSamples;
        if (decision.responseTimeMs() != null) {
            samples++;
            avg = avg + (decision.responseTimeMs() - avg) / samples;
        }
        return new AggregatedMetric(modelName, complexityLevel, usage, success, avg, samples, createdAt, at);
    }

    @JsonProperty("success_rate")
    public double successRate() {
        return usageCount == 0 ? 0.0 : (double) successCount / usageCount;
    }

    @JsonIgnore
    public boolean hasResponseTimes() {
        return responseTimeSamples > 0;
    }

    @JsonIgnore
    public AggregateKey key() {
        return new AggregateKey(modelName, complexityLevel);
    }
}
