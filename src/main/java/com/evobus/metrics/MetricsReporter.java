package com.evobus.metrics;

import com.evobus.config.EvolutionProperties;
import com.evobus.queue.DurableQueue;
import com.evobus.queue.MessageCodec;
import com.evobus.queue.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.DoubleSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Buffers agent metrics locally and ships them to the fleet in batches.
 *
 * A batch leaves the buffer only after the queue accepted it; on failure the entries go
 * back in front of anything recorded meanwhile. The buffer has a hard capacity and drops
 * its oldest entries when it overflows.
 */
@Component
public class MetricsReporter {

    private static final Logger log = LoggerFactory.getLogger(MetricsReporter.class);

    private final DurableQueue queue;
    private final MessageCodec codec;
    private final Clock clock;
    private final String instanceId;
    private final int bufferCapacity;
    private final int cacheDepth;

    private final Deque<MetricEntry> buffer = new ArrayDeque<>();
    private final ConcurrentHashMap<String, Map<String, Deque<Double>>> recent = new ConcurrentHashMap<>();
    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicLong totalRecorded = new AtomicLong();
    private final AtomicLong totalBatchesSent = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile Instant lastFlushAt;

    public MetricsReporter(DurableQueue queue, MessageCodec codec, Clock clock, EvolutionProperties properties) {
        this.queue = queue;
        this.codec = codec;
        this.clock = clock;
        this.instanceId = properties.getInstanceId();
        this.bufferCapacity = Math.max(1, properties.getMetrics().getBufferCapacity());
        this.cacheDepth = Math.max(1, properties.getMetrics().getCacheDepth());
    }

    public void recordMetric(String agentType, String name, double value) {
        if (agentType == null || agentType.isBlank() || name == null || name.isBlank()) {
            throw new IllegalArgumentException("agent_type and metric name are required");
        }
        MetricEntry entry = new MetricEntry(agentType, name, value, clock.instant());
        synchronized (buffer) {
            buffer.addLast(entry);
            trimToCapacity();
        }
        remember(entry);
        totalRecorded.incrementAndGet();
    }

    public void recordMetrics(String agentType, Map<String, ? extends Number> metrics) {
        if (metrics == null) {
            return;
        }
        metrics.forEach((name, value) -> {
            if (value != null) {
                recordMetric(agentType, name, value.doubleValue());
            }
        });
    }

    /**
     * Send everything buffered as one batch.
     *
     * @return number of entries sent; 0 when the buffer was empty, a flush was already
     *         running, or the send failed
     */
    public int flush() {
        if (!flushLock.tryLock()) {
            return 0;
        }
        try {
            List<MetricEntry> snapshot;
            synchronized (buffer) {
                if (buffer.isEmpty()) {
                    return 0;
                }
                snapshot = new ArrayList<>(buffer);
                buffer.clear();
            }

            Instant now = clock.instant();
            AgentMetricsBatch batch = new AgentMetricsBatch(instanceId, now, snapshot, summarize(snapshot));
            try {
                queue.enqueue(QueueNames.AGENT_METRICS, codec.encode(batch));
            } catch (RuntimeException ex) {
                restore(snapshot);
                log.warn("Metrics flush failed, {} entries kept for next attempt: {}", snapshot.size(), ex.getMessage());
                return 0;
            }

            totalBatchesSent.incrementAndGet();
            lastFlushAt = now;
            log.debug("Flushed {} metrics", snapshot.size());
            return snapshot.size();
        } finally {
            flushLock.unlock();
        }
    }

    @Scheduled(
        initialDelayString = "${evolution.metrics.flush-interval-ms:60000}",
        fixedDelayString = "${evolution.metrics.flush-interval-ms:60000}"
    )
    public void scheduledFlush() {
        flush();
    }

    /** Most recent values per metric name for one agent type, oldest first. */
    public Map<String, List<Double>> getMetrics(String agentType) {
        Map<String, Deque<Double>> byName = recent.get(agentType);
        if (byName == null) {
            return Map.of();
        }
        Map<String, List<Double>> copy = new TreeMap<>();
        synchronized (byName) {
            byName.forEach((name, values) -> copy.put(name, new ArrayList<>(values)));
        }
        return copy;
    }

    public MetricsStats getStats() {
        int size;
        synchronized (buffer) {
            size = buffer.size();
        }
        return new MetricsStats(totalRecorded.get(), totalBatchesSent.get(), size, dropped.get(), lastFlushAt);
    }

    private void restore(List<MetricEntry> snapshot) {
        synchronized (buffer) {
            for (int i = snapshot.size() - 1; i >= 0; i--) {
                buffer.addFirst(snapshot.get(i));
            }
            trimToCapacity();
        }
    }

    // caller holds the buffer monitor
    private void trimToCapacity() {
        int overflow = buffer.size() - bufferCapacity;
        if (overflow <= 0) {
            return;
        }
        for (int i = 0; i < overflow; i++) {
            buffer.pollFirst();
        }
        dropped.addAndGet(overflow);
        log.warn("Metrics buffer over capacity {}, dropped {} oldest entries", bufferCapacity, overflow);
    }

    private void remember(MetricEntry entry) {
        Map<String, Deque<Double>> byName = recent.computeIfAbsent(entry.agentType(), k -> new LinkedHashMap<>());
        synchronized (byName) {
            Deque<Double> values = byName.computeIfAbsent(entry.metricName(), k -> new ArrayDeque<>());
            values.addLast(entry.value());
            while (values.size() > cacheDepth) {
                values.pollFirst();
            }
        }
    }

    private static List<AgentMetricsBatch.AgentSummary> summarize(List<MetricEntry> entries) {
        Map<String, Map<String, DoubleSummaryStatistics>> grouped = entries.stream()
            .collect(Collectors.groupingBy(MetricEntry::agentType, TreeMap::new,
                Collectors.groupingBy(MetricEntry::metricName, TreeMap::new,
                    Collectors.summarizingDouble(MetricEntry::value))));

        List<AgentMetricsBatch.AgentSummary> summaries = new ArrayList<>();
        grouped.forEach((agentType, byName) -> {
            List<AgentMetricsBatch.MetricSummary> metrics = new ArrayList<>();
            byName.forEach((name, stats) -> metrics.add(new AgentMetricsBatch.MetricSummary(
                name,
                (int) stats.getCount(),
                Math.round(stats.getAverage() * 1000.0) / 1000.0,
                stats.getMin(),
                stats.getMax()
            )));
            summaries.add(new AgentMetricsBatch.AgentSummary(agentType, metrics));
        });
        return summaries;
    }
}
