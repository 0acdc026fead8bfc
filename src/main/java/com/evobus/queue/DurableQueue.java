package com.evobus.queue;

import java.util.List;

/**
 * Broker-agnostic durable queue with claim/ack semantics.
 *
 * A dequeued message stays in flight until it is acked (removed) or nacked (made
 * visible again at the head of the queue). Delivery is at-least-once, so consumers
 * must be idempotent.
 */
public interface DurableQueue {

    /**
     * Append a message to the tail of the queue.
     *
     * @throws QueueUnavailableException when the broker cannot accept the message
     */
    void enqueue(String queue, String message);

    /** Claim up to {@code maxBatch} messages in arrival order. */
    List<QueueMessage> dequeue(String queue, int maxBatch);

    void ack(String queue, String ackToken);

    /** Release a claimed message for redelivery. */
    void nack(String queue, String ackToken);

    /** Messages waiting to be claimed (in-flight messages are not counted). */
    int depth(String queue);

    record QueueMessage(String ackToken, String payload) {}
}
