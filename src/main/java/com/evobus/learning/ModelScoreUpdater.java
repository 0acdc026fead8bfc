package com.evobus.learning;

import com.evobus.config.EvolutionProperties;
import com.evobus.queue.DurableQueue;
import com.evobus.queue.MessageCodec;
import com.evobus.queue.QueueNames;
import com.evobus.routing.RoutingMetricsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Broadcasts score updates to the per-instance score-updates queues.
 *
 * Targets are this instance, the instances listed in configuration and every instance
 * that reported routing decisions within the instance TTL. Each publish is retried a
 * bounded number of times.
 */
@Component
public class ModelScoreUpdater {

    private static final Logger log = LoggerFactory.getLogger(ModelScoreUpdater.class);

    private final DurableQueue queue;
    private final MessageCodec codec;
    private final RoutingMetricsStore metricsStore;
    private final Clock clock;
    private final String instanceId;
    private final List<String> configuredInstances;
    private final int publishAttempts;
    private final long retryBackoffMs;
    private final long instanceTtlMs;

    public ModelScoreUpdater(DurableQueue queue,
                             MessageCodec codec,
                             RoutingMetricsStore metricsStore,
                             Clock clock,
                             EvolutionProperties properties) {
        this.queue = queue;
        this.codec = codec;
        this.metricsStore = metricsStore;
        this.clock = clock;
        this.instanceId = properties.getInstanceId();
        this.configuredInstances = List.copyOf(properties.getScoreUpdates().getInstances());
        this.publishAttempts = Math.max(1, properties.getScoreUpdates().getPublishAttempts());
        this.retryBackoffMs = Math.max(0L, properties.getScoreUpdates().getRetryBackoffMs());
        this.instanceTtlMs = properties.getScoreUpdates().getInstanceTtlMs();
    }

    public Set<String> targetInstances() {
        Set<String> targets = new TreeSet<>(configuredInstances);
        targets.add(instanceId);
        Instant since = instanceTtlMs > 0 ? clock.instant().minusMillis(instanceTtlMs) : null;
        targets.addAll(metricsStore.activeInstanceIds(since));
        return targets;
    }

    public PublishReport publish(ScoreUpdateEvent event) {
        String payload = codec.encode(event);
        List<String> delivered = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String target : targetInstances()) {
            if (publishWithRetry(QueueNames.scoreUpdates(target), payload)) {
                delivered.add(target);
            } else {
                failed.add(target);
            }
        }
        if (failed.isEmpty()) {
            log.info("Score update {}/{} {} -> {} delivered to {} instances",
                event.model(), event.complexity().getValue(), event.oldScore(), event.newScore(), delivered.size());
        } else {
            log.warn("Score update {}/{} not delivered to {}", event.model(), event.complexity().getValue(), failed);
        }
        return new PublishReport(delivered, failed);
    }

    private boolean publishWithRetry(String queueName, String payload) {
        for (int attempt = 1; attempt <= publishAttempts; attempt++) {
            try {
                queue.enqueue(queueName, payload);
                return true;
            } catch (RuntimeException ex) {
                log.warn("Publish to {} failed (attempt {}/{}): {}", queueName, attempt, publishAttempts, ex.getMessage());
                if (attempt < publishAttempts && !sleep(retryBackoffMs * attempt)) {
                    return false;
                }
            }
        }
        return false;
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
