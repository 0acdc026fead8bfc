package com.evobus.learning;

import com.evobus.config.EvolutionProperties;
import com.evobus.routing.AggregatedMetric;
import com.evobus.routing.RoutingMetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodically turns routing aggregates into routing score updates.
 *
 * A new score is committed only once every instance accepted the update; a partially
 * delivered update is recomputed from the old score on the next cycle.
 */
@Component
public class ComplexityScoreLearner {

    private static final Logger log = LoggerFactory.getLogger(ComplexityScoreLearner.class);

    private final RoutingMetricsStore metricsStore;
    private final ModelScoreStore scoreStore;
    private final ModelScoreUpdater updater;
    private final ScoreAdjustmentRules rules;
    private final Clock clock;
    private final long minSampleThreshold;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<LearningCycleResult> lastCycle = new AtomicReference<>();

    public ComplexityScoreLearner(RoutingMetricsStore metricsStore,
                                  ModelScoreStore scoreStore,
                                  ModelScoreUpdater updater,
                                  Clock clock,
                                  EvolutionProperties properties) {
        this.metricsStore = metricsStore;
        this.scoreStore = scoreStore;
        this.updater = updater;
        this.clock = clock;
        this.rules = new ScoreAdjustmentRules(properties.getLearner());
        this.minSampleThreshold = properties.getLearner().getMinSampleThreshold();
    }

    @Scheduled(
        initialDelayString = "${evolution.learner.interval-ms:60000}",
        fixedDelayString = "${evolution.learner.interval-ms:60000}"
    )
    public void tick() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            runCycle();
        } catch (RuntimeException ex) {
            log.error("Learning cycle failed", ex);
        } finally {
            running.set(false);
        }
    }

    public LearningCycleResult runCycle() {
        Instant startedAt = clock.instant();
        int evaluated = 0;
        int belowThreshold = 0;
        int suppressed = 0;
        int undelivered = 0;
        List<ScoreUpdateEvent> published = new ArrayList<>();

        for (AggregatedMetric metric : metricsStore.allAggregates()) {
            if (metric.usageCount() < minSampleThreshold) {
                belowThreshold++;
                continue;
            }
            evaluated++;

            double oldScore = scoreStore.currentScore(metric.modelName(), metric.complexityLevel());
            ScoreAdjustment adjustment = rules.evaluate(metric, oldScore);
            if (!adjustment.significant()) {
                suppressed++;
                log.debug("Suppressed score change for {} ({} -> {})",
                    metric.key(), adjustment.oldScore(), adjustment.newScore());
                continue;
            }

            ScoreUpdateEvent event = new ScoreUpdateEvent(
                metric.modelName(),
                metric.complexityLevel(),
                adjustment.oldScore(),
                adjustment.newScore(),
                adjustment.reason(),
                adjustment.successRate(),
                metric.usageCount(),
                clock.instant()
            );
            PublishReport report = updater.publish(event);
            if (report.fullyDelivered()) {
                scoreStore.commit(event.model(), event.complexity(), event.newScore());
                published.add(event);
            } else {
                undelivered++;
            }
        }

        LearningCycleResult result = new LearningCycleResult(startedAt, evaluated, belowThreshold, suppressed,
            List.copyOf(published), undelivered);
        lastCycle.set(result);
        log.info("Learning cycle evaluated={} below_threshold={} suppressed={} published={} undelivered={}",
            evaluated, belowThreshold, suppressed, published.size(), undelivered);
        return result;
    }

    public Optional<LearningCycleResult> lastCycle() {
        return Optional.ofNullable(lastCycle.get());
    }
}
