package com.evobus.routing;

import com.evobus.contract.ComplexityLevel;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Routing decision audit log plus the per (model, complexity) aggregates derived from it.
 */
public interface RoutingMetricsStore {

    /**
     * Append the decision and fold it into its aggregate. The aggregate read-modify-write
     * is serialized per key.
     *
     * @return the updated aggregate, or empty when a decision with the same decision_id
     *         was already recorded
     */
    Optional<AggregatedMetric> recordDecision(RoutingDecisionRecord decision);

    Optional<AggregatedMetric> findAggregate(String model, ComplexityLevel complexity);

    List<AggregatedMetric> allAggregates();

    /** Decisions at or after {@code since}, newest first, optionally for one instance. */
    List<RoutingDecisionRecord> findDecisions(String instanceId, Instant since, int limit);

    /**
     * Instances whose latest routing decision was recorded at or after {@code since}.
     * A null {@code since} returns every instance that has reported.
     */
    Set<String> activeInstanceIds(Instant since);
}
