package com.evobus.api;

import com.evobus.config.EvolutionProperties;
import com.evobus.coordinator.AgentCoordinator;
import com.evobus.learning.ComplexityScoreLearner;
import com.evobus.learning.ModelScoreStore;
import com.evobus.metrics.MetricsReporter;
import com.evobus.metrics.MetricsStats;
import com.evobus.routing.AggregatedMetric;
import com.evobus.routing.ConsumerStatus;
import com.evobus.routing.RoutingEventConsumer;
import com.evobus.routing.RoutingMetricsStore;
import com.evobus.safety.SafetyProfile;
import com.evobus.safety.SafetyProfileRegistry;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Agent-facing side channels (patterns, metrics, safety profiles) and the operator view
 * of the fleet learning loop.
 */
@RestController
@RequestMapping("/v1")
public class FleetController {

    private final AgentCoordinator coordinator;
    private final SafetyProfileRegistry profileRegistry;
    private final MetricsReporter metricsReporter;
    private final RoutingEventConsumer routingConsumer;
    private final RoutingMetricsStore routingMetrics;
    private final ComplexityScoreLearner learner;
    private final ModelScoreStore scoreStore;
    private final EvolutionProperties properties;

    public FleetController(AgentCoordinator coordinator,
                           SafetyProfileRegistry profileRegistry,
                           MetricsReporter metricsReporter,
                           RoutingEventConsumer routingConsumer,
                           RoutingMetricsStore routingMetrics,
                           ComplexityScoreLearner learner,
                           ModelScoreStore scoreStore,
                           EvolutionProperties properties) {
        this.coordinator = coordinator;
        this.profileRegistry = profileRegistry;
        this.metricsReporter = metricsReporter;
        this.routingConsumer = routingConsumer;
        this.routingMetrics = routingMetrics;
        this.learner = learner;
        this.scoreStore = scoreStore;
        this.properties = properties;
    }

    @PostMapping("/patterns")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> recordPattern(@RequestBody PatternRequest request) {
        coordinator.recordPattern(request.agentType(), request.category(), request.pattern());
        return Map.of("status", "recorded");
    }

    @PostMapping("/metrics")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public MetricsStats recordMetrics(@RequestBody MetricsRequest request) {
        metricsReporter.recordMetrics(request.agentType(), request.metrics());
        return metricsReporter.getStats();
    }

    @GetMapping("/metrics/{agentType}")
    public Map<String, List<Double>> metrics(@PathVariable String agentType) {
        return metricsReporter.getMetrics(agentType);
    }

    @GetMapping("/safety-profiles")
    public List<SafetyProfile> profiles() {
        return profileRegistry.listProfiles();
    }

    @GetMapping("/safety-profiles/{agentType}")
    public SafetyProfile profile(@PathVariable String agentType) {
        return profileRegistry.getProfile(agentType);
    }

    @PostMapping("/safety-profiles")
    @ResponseStatus(HttpStatus.CREATED)
    public SafetyProfile registerProfile(@RequestBody SafetyProfile profile) {
        return profileRegistry.registerProfile(profile);
    }

    @PutMapping("/safety-profiles")
    public SafetyProfile updateProfile(@RequestBody SafetyProfile profile) {
        return profileRegistry.updateProfile(profile);
    }

    @GetMapping("/fleet/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("instance_id", properties.getInstanceId());
        body.put("routing_consumer", routingConsumer.status());
        learner.lastCycle().ifPresent(cycle -> body.put("last_learning_cycle", cycle));
        body.put("metrics_reporter", metricsReporter.getStats());
        return body;
    }

    @PostMapping("/fleet/routing-consumer/resume")
    public ConsumerStatus resumeRoutingConsumer() {
        routingConsumer.resume();
        return routingConsumer.status();
    }

    @GetMapping("/fleet/aggregates")
    public List<AggregatedMetric> aggregates() {
        return routingMetrics.allAggregates();
    }

    @GetMapping("/fleet/scores")
    public Map<String, Double> scores() {
        Map<String, Double> scores = new TreeMap<>();
        scoreStore.snapshot().forEach((key, score) -> scores.put(key.toString(), score));
        return scores;
    }

    public record PatternRequest(
        @JsonProperty("agent_type") String agentType,
        @JsonProperty("category") String category,
        @JsonProperty("pattern") Map<String, Object> pattern
    ) {}

    public record MetricsRequest(
        @JsonProperty("agent_type") String agentType,
        @JsonProperty("metrics") Map<String, Double> metrics
    ) {}
}
