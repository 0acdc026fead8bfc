package com.evobus.routing;

import com.evobus.analysis.PerformanceAdvisory;
import com.evobus.analysis.PerformanceAnalyzer;
import com.evobus.config.EvolutionProperties;
import com.evobus.contract.ChangeContractValidator;
import com.evobus.contract.RoutingDecisionMessage;
import com.evobus.queue.DurableQueue;
import com.evobus.queue.MessageCodec;
import com.evobus.queue.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drains the routing-decisions queue into the audit log and the per (model, complexity)
 * aggregates.
 *
 * <p>A failed message is released for redelivery and the consumer backs off
 * exponentially. After {@code max-consecutive-errors} failures in a row it halts and
 * stays halted until {@link #resume()} is called, so a poisoned message cannot keep it
 * spinning. Ticks never throw.
 */
@Component
public class RoutingEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(RoutingEventConsumer.class);

    private final DurableQueue queue;
    private final MessageCodec codec;
    private final ChangeContractValidator validator;
    private final RoutingMetricsStore metricsStore;
    private final PerformanceAnalyzer analyzer;
    private final Clock clock;
    private final int batchSize;
    private final int maxConsecutiveErrors;
    private final long backoffBaseMs;
    private final long backoffMaxMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private volatile int consecutiveErrors;
    private volatile boolean halted;
    private volatile Instant backoffUntil;
    private volatile String lastError;

    public RoutingEventConsumer(DurableQueue queue,
                                MessageCodec codec,
                                ChangeContractValidator validator,
                                RoutingMetricsStore metricsStore,
                                PerformanceAnalyzer analyzer,
                                Clock clock,
                                EvolutionProperties properties) {
        this.queue = queue;
        this.codec = codec;
        this.validator = validator;
        this.metricsStore = metricsStore;
        this.analyzer = analyzer;
        this.clock = clock;
        EvolutionProperties.Routing routing = properties.getRouting();
        this.batchSize = Math.max(1, routing.getBatchSize());
        this.maxConsecutiveErrors = Math.max(1, routing.getMaxConsecutiveErrors());
        this.backoffBaseMs = Math.max(0L, routing.getBackoffBaseMs());
        this.backoffMaxMs = Math.max(this.backoffBaseMs, routing.getBackoffMaxMs());
    }

    @Scheduled(
        initialDelayString = "${evolution.routing.poll-interval-ms:5000}",
        fixedDelayString = "${evolution.routing.poll-interval-ms:5000}"
    )
    public void tick() {
        try {
            poll();
        } catch (RuntimeException ex) {
            log.error("Routing consumer tick failed unexpectedly", ex);
        }
    }

    /**
     * Process one batch.
     *
     * @return number of messages recorded in this tick
     */
    public int poll() {
        if (!running.compareAndSet(false, true)) {
            return 0;
        }
        try {
            if (halted) {
                return 0;
            }
            Instant until = backoffUntil;
            if (until != null && clock.instant().isBefore(until)) {
                return 0;
            }

            List<DurableQueue.QueueMessage> messages;
            try {
                messages = queue.dequeue(QueueNames.ROUTING_DECISIONS, batchSize);
            } catch (RuntimeException ex) {
                recordFailure("dequeue failed: " + ex.getMessage());
                return 0;
            }

            int recorded = 0;
            for (int i = 0; i < messages.size(); i++) {
                DurableQueue.QueueMessage message = messages.get(i);
                try {
                    if (handle(message.payload())) {
                        recorded++;
                    }
                    queue.ack(QueueNames.ROUTING_DECISIONS, message.ackToken());
                    recordSuccess();
                } catch (RuntimeException ex) {
                    // Release the failed message and the rest of the batch in their original order.
                    for (int j = messages.size() - 1; j >= i; j--) {
                        releaseQuietly(messages.get(j));
                    }
                    recordFailure(ex.getClass().getSimpleName() + ": " + ex.getMessage());
                    break;
                }
            }
            return recorded;
        } finally {
            running.set(false);
        }
    }

    /** Clear a halt after an operator dealt with the poisoned input. */
    public void resume() {
        halted = false;
        consecutiveErrors = 0;
        backoffUntil = null;
        log.info("Routing consumer resumed");
    }

    public ConsumerStatus status() {
        ConsumerHealth health;
        Instant until = backoffUntil;
        if (halted) {
            health = ConsumerHealth.HALTED;
        } else if (until != null && clock.instant().isBefore(until)) {
            health = ConsumerHealth.BACKING_OFF;
        } else {
            health = ConsumerHealth.RUNNING;
        }
        return new ConsumerStatus(health, consecutiveErrors, processed.get(), succeeded.get(), failed.get(),
            duplicates.get(), lastError, until);
    }

    private boolean handle(String payload) {
        processed.incrementAndGet();
        RoutingDecisionMessage message = codec.decode(payload, RoutingDecisionMessage.class);
        validator.validateRoutingDecision(message);

        RoutingDecisionRecord decision = RoutingDecisionRecord.from(message, clock.instant());
        Optional<AggregatedMetric> aggregate = metricsStore.recordDecision(decision);
        if (aggregate.isEmpty()) {
            duplicates.incrementAndGet();
            log.debug("Skipping redelivered routing decision {}", decision.decisionId());
            return false;
        }
        analyze(aggregate.get());
        return true;
    }

    private void analyze(AggregatedMetric aggregate) {
        try {
            for (PerformanceAdvisory advisory : analyzer.analyze(aggregate)) {
                log.warn("Performance advisory {}: {}", advisory.type().getValue(), advisory.message());
                queue.enqueue(QueueNames.PERFORMANCE_ADVISORIES, codec.encode(advisory));
            }
        } catch (RuntimeException ex) {
            log.warn("Performance analysis failed for {}: {}", aggregate.key(), ex.getMessage());
        }
    }

    private void recordSuccess() {
        succeeded.incrementAndGet();
        consecutiveErrors = 0;
        backoffUntil = null;
    }

    private void recordFailure(String error) {
        failed.incrementAndGet();
        lastError = error;
        int errors = ++consecutiveErrors;
        if (errors >= maxConsecutiveErrors) {
            halted = true;
            backoffUntil = null;
            log.error("ALERT routing consumer halted after {} consecutive errors, operator action required. last_error={}",
                errors, error);
            return;
        }
        long delay = backoffDelayMs(errors);
        backoffUntil = clock.instant().plusMillis(delay);
        log.warn("Routing consumer error {}/{}, backing off {}ms: {}", errors, maxConsecutiveErrors, delay, error);
    }

    private long backoffDelayMs(int errors) {
        int shift = Math.min(errors - 1, 20);
        long delay = backoffBaseMs << shift;
        return Math.min(delay, backoffMaxMs);
    }

    private void releaseQuietly(DurableQueue.QueueMessage message) {
        try {
            queue.nack(QueueNames.ROUTING_DECISIONS, message.ackToken());
        } catch (RuntimeException ex) {
            log.warn("Could not release routing decision {}: {}", message.ackToken(), ex.getMessage());
        }
    }
}
