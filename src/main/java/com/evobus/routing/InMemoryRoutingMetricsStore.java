package com.evobus.routing;

import com.evobus.contract.ComplexityLevel;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

@Component
public class InMemoryRoutingMetricsStore implements RoutingMetricsStore {

    private final Clock clock;
    private final CopyOnWriteArrayList<RoutingDecisionRecord> decisions = new CopyOnWriteArrayList<>();
    private final Set<String> decisionIds = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<AggregateKey, AggregatedMetric> aggregates = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Instant> lastSeenByInstance = new ConcurrentHashMap<>();

    public InMemoryRoutingMetricsStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<AggregatedMetric> recordDecision(RoutingDecisionRecord decision) {
        if (decision.decisionId() != null && !decisionIds.add(decision.decisionId())) {
            return Optional.empty();
        }
        decisions.add(decision);
        Instant now = clock.instant();
        if (decision.instanceId() != null) {
            lastSeenByInstance.merge(decision.instanceId(), now, (a, b) -> a.isAfter(b) ? a : b);
        }
        AggregatedMetric updated = aggregates.compute(decision.key(), (key, existing) ->
            (existing == null ? AggregatedMetric.empty(key, now) : existing).record(decision, now));
        return Optional.of(updated);
    }

    @Override
    public Optional<AggregatedMetric> findAggregate(String model, ComplexityLevel complexity) {
        return Optional.ofNullable(aggregates.get(new AggregateKey(model, complexity)));
    }

    @Override
    public List<AggregatedMetric> allAggregates() {
        return aggregates.values().stream()
            .sorted(Comparator.comparing(AggregatedMetric::modelName).thenComparing(AggregatedMetric::complexityLevel))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<RoutingDecisionRecord> findDecisions(String instanceId, Instant since, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return decisions.stream()
            .filter(d -> instanceId == null || instanceId.equals(d.instanceId()))
            .filter(d -> since == null || !d.timestamp().isBefore(since))
            .sorted(Comparator.comparing(RoutingDecisionRecord::timestamp).reversed())
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public Set<String> activeInstanceIds(Instant since) {
        return lastSeenByInstance.entrySet().stream()
            .filter(e -> since == null || !e.getValue().isBefore(since))
            .map(Map.Entry::getKey)
            .collect(Collectors.toCollection(TreeSet::new));
    }
}
