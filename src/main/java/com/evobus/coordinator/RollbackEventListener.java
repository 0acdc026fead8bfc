package com.evobus.coordinator;

import com.evobus.proposal.ProposalNotFoundException;
import com.evobus.queue.DurableQueue;
import com.evobus.queue.MessageCodec;
import com.evobus.queue.MessageFormatException;
import com.evobus.queue.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.List;
import java.util.Map;

/**
 * Applies rollback requests raised elsewhere in the fleet (guardians, operators) from this
 * instance's rollback-events queue. Messages carry {@code proposal_id} and an optional
 * {@code reason}.
 */
public class RollbackEventListener {

    private static final Logger log = LoggerFactory.getLogger(RollbackEventListener.class);
    private static final int BATCH = 50;
    private static final String GUARDIAN_REASON = "guardian_triggered";

    private final AgentCoordinator coordinator;
    private final DurableQueue queue;
    private final MessageCodec codec;
    private final String queueName;

    public RollbackEventListener(AgentCoordinator coordinator, DurableQueue queue, MessageCodec codec,
                                 String instanceId) {
        this.coordinator = coordinator;
        this.queue = queue;
        this.codec = codec;
        this.queueName = QueueNames.rollbackEvents(instanceId);
    }

    @Scheduled(
        initialDelayString = "${evolution.rollback.poll-interval-ms:5000}",
        fixedDelayString = "${evolution.rollback.poll-interval-ms:5000}"
    )
    public void tick() {
        try {
            drain();
        } catch (RuntimeException ex) {
            log.error("Rollback event drain failed", ex);
        }
    }

    /**
     * @return number of rollback events applied
     */
    public int drain() {
        List<DurableQueue.QueueMessage> messages = queue.dequeue(queueName, BATCH);
        int applied = 0;
        for (DurableQueue.QueueMessage message : messages) {
            try {
                Map<String, Object> event = codec.decodeMap(message.payload());
                if (!(event.get("proposal_id") instanceof String proposalId) || proposalId.isBlank()) {
                    throw new MessageFormatException("rollback event needs proposal_id");
                }
                Object reason = event.get("reason");
                coordinator.handleRollback(proposalId, reason instanceof String text ? text : GUARDIAN_REASON);
                queue.ack(queueName, message.ackToken());
                applied++;
            } catch (MessageFormatException | ProposalNotFoundException ex) {
                log.warn("Dropping rollback event: {}", ex.getMessage());
                queue.ack(queueName, message.ackToken());
            } catch (RollbackException ex) {
                log.error("Rollback failed, event kept for retry: {}", ex.getMessage());
                queue.nack(queueName, message.ackToken());
            }
        }
        return applied;
    }
}
