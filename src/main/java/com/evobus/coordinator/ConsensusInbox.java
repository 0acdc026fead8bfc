package com.evobus.coordinator;

import com.evobus.queue.DurableQueue;
import com.evobus.queue.MessageCodec;
import com.evobus.queue.MessageFormatException;
import com.evobus.queue.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-proposal mailbox fed from this instance's consensus-responses queue. A response is
 * held here until exactly one reader takes it or it expires unclaimed.
 */
public class ConsensusInbox {

    private static final Logger log = LoggerFactory.getLogger(ConsensusInbox.class);
    private static final int DRAIN_BATCH = 100;

    private final DurableQueue queue;
    private final MessageCodec codec;
    private final Clock clock;
    private final String queueName;
    private final ConcurrentHashMap<String, Held> responses = new ConcurrentHashMap<>();

    public ConsensusInbox(DurableQueue queue, MessageCodec codec, Clock clock, String instanceId) {
        this.queue = queue;
        this.codec = codec;
        this.clock = clock;
        this.queueName = QueueNames.consensusResponses(instanceId);
    }

    /**
     * Move every waiting consensus response into the mailbox.
     *
     * @return number of responses accepted
     */
    public int drain() {
        List<DurableQueue.QueueMessage> messages;
        try {
            messages = queue.dequeue(queueName, DRAIN_BATCH);
        } catch (RuntimeException ex) {
            log.warn("Cannot read {}: {}", queueName, ex.getMessage());
            return 0;
        }

        int accepted = 0;
        for (DurableQueue.QueueMessage message : messages) {
            try {
                ConsensusResponse response = codec.decode(message.payload(), ConsensusResponse.class);
                if (response.proposalId() == null || response.decision() == null) {
                    throw new MessageFormatException("consensus response needs proposal_id and decision");
                }
                responses.put(response.proposalId(), new Held(response, clock.instant()));
                accepted++;
            } catch (MessageFormatException ex) {
                // Redelivery cannot fix a malformed response.
                log.warn("Discarding malformed consensus response: {}", ex.getMessage());
            }
            queue.ack(queueName, message.ackToken());
        }
        return accepted;
    }

    public Optional<ConsensusResponse> take(String proposalId) {
        Held held = responses.remove(proposalId);
        return held == null ? Optional.empty() : Optional.of(held.response());
    }

    public Set<String> waitingProposalIds() {
        return Set.copyOf(responses.keySet());
    }

    /**
     * Drop responses that nobody claimed since {@code cutoff}.
     *
     * @return number of responses dropped
     */
    public int expireUnclaimed(Instant cutoff) {
        int expired = 0;
        for (Map.Entry<String, Held> entry : responses.entrySet()) {
            if (entry.getValue().receivedAt().isBefore(cutoff) && responses.remove(entry.getKey(), entry.getValue())) {
                log.warn("Dropping unclaimed consensus response for proposal {}", entry.getKey());
                expired++;
            }
        }
        return expired;
    }

    private record Held(ConsensusResponse response, Instant receivedAt) {
    }
}
