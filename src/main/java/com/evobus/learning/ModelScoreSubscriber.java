package com.evobus.learning;

import com.evobus.config.EvolutionProperties;
import com.evobus.contract.ComplexityLevel;
import com.evobus.queue.DurableQueue;
import com.evobus.queue.MessageCodec;
import com.evobus.queue.MessageFormatException;
import com.evobus.queue.QueueNames;
import com.evobus.routing.AggregateKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Instance-side cache of learned routing scores, fed from this instance's score-updates
 * queue. Updates overwrite; an update older than the cached one is ignored, so
 * redelivery and reordering are harmless.
 */
@Component
public class ModelScoreSubscriber {

    private static final Logger log = LoggerFactory.getLogger(ModelScoreSubscriber.class);
    private static final int BATCH = 100;

    private final DurableQueue queue;
    private final MessageCodec codec;
    private final String queueName;
    private final ConcurrentHashMap<AggregateKey, ScoreUpdateEvent> cache = new ConcurrentHashMap<>();

    public ModelScoreSubscriber(DurableQueue queue, MessageCodec codec, EvolutionProperties properties) {
        this.queue = queue;
        this.codec = codec;
        this.queueName = QueueNames.scoreUpdates(properties.getInstanceId());
    }

    @Scheduled(
        initialDelayString = "${evolution.routing.poll-interval-ms:5000}",
        fixedDelayString = "${evolution.routing.poll-interval-ms:5000}"
    )
    public void tick() {
        try {
            poll();
        } catch (RuntimeException ex) {
            log.error("Score update poll failed", ex);
        }
    }

    /**
     * @return number of updates read from the queue
     */
    public int poll() {
        List<DurableQueue.QueueMessage> messages = queue.dequeue(queueName, BATCH);
        for (DurableQueue.QueueMessage message : messages) {
            try {
                apply(codec.decode(message.payload(), ScoreUpdateEvent.class));
            } catch (MessageFormatException ex) {
                log.warn("Discarding malformed score update: {}", ex.getMessage());
            }
            queue.ack(queueName, message.ackToken());
        }
        return messages.size();
    }

    public void apply(ScoreUpdateEvent event) {
        if (event.model() == null || event.complexity() == null) {
            throw new MessageFormatException("score update needs model and complexity");
        }
        cache.compute(new AggregateKey(event.model(), event.complexity()), (key, current) -> {
            if (current != null && current.timestamp() != null && event.timestamp() != null
                && event.timestamp().isBefore(current.timestamp())) {
                log.debug("Ignoring stale score update for {}", key);
                return current;
            }
            return event;
        });
    }

    public Optional<Double> score(String model, ComplexityLevel complexity) {
        return Optional.ofNullable(cache.get(new AggregateKey(model, complexity))).map(ScoreUpdateEvent::newScore);
    }

    public Map<AggregateKey, Double> scores() {
        return cache.entrySet().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().newScore()));
    }
}
