package com.evobus.routing;

import com.evobus.contract.ComplexityLevel;
import com.evobus.contract.RoutingDecisionMessage;
import com.evobus.contract.RoutingOutcome;

import java.time.Instant;
import java.util.List;

/**
 * Append-only audit row for one routing decision. Never updated after insert.
 */
public record RoutingDecisionRecord(
    String decisionId,
    String instanceId,
    ComplexityLevel complexity,
    String model,
    String provider,
    Double score,
    RoutingOutcome outcome,
    Long responseTimeMs,
    List<String> capabilitiesRequired,
    String preference,
    Instant timestamp
) {

    public static RoutingDecisionRecord from(RoutingDecisionMessage message, Instant receivedAt) {
        return new RoutingDecisionRecord(
            message.decisionId(),
            message.instanceId(),
            message.complexity(),
            message.model(),
            message.provider(),
            message.score(),
            message.outcome(),
            message.responseTimeMs(),
            message.capabilitiesRequired() == null ? List.of() : List.copyOf(message.capabilitiesRequired()),
            message.preference(),
            message.timestamp() != null ? message.timestamp() : receivedAt
        );
    }

    public AggregateKey key() {
        return new AggregateKey(model, complexity);
    }
}
