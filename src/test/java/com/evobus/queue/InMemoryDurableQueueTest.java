package com.evobus.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDurableQueueTest {

    private InMemoryDurableQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryDurableQueue();
    }

    @Test
    @DisplayName("Messages are claimed in arrival order up to the batch size")
    void dequeue_respectsOrderAndBatch() {
        queue.enqueue("q", "a");
        queue.enqueue("q", "b");
        queue.enqueue("q", "c");

        List<DurableQueue.QueueMessage> batch = queue.dequeue("q", 2);

        assertEquals(List.of("a", "b"), batch.stream().map(DurableQueue.QueueMessage::payload).toList());
        assertEquals(1, queue.depth("q"));
        assertEquals(2, queue.inFlight("q"));
    }

    @Test
    @DisplayName("Ack removes a claimed message for good")
    void ack_removesMessage() {
        queue.enqueue("q", "a");
        DurableQueue.QueueMessage message = queue.dequeue("q", 1).get(0);

        queue.ack("q", message.ackToken());

        assertEquals(0, queue.depth("q"));
        assertEquals(0, queue.inFlight("q"));
        assertTrue(queue.dequeue("q", 10).isEmpty());
    }

    @Test
    @DisplayName("Nack puts a message back at the head for redelivery")
    void nack_redeliversFirst() {
        queue.enqueue("q", "a");
        queue.enqueue("q", "b");
        DurableQueue.QueueMessage first = queue.dequeue("q", 1).get(0);

        queue.nack("q", first.ackToken());

        List<DurableQueue.QueueMessage> again = queue.dequeue("q", 2);
        assertEquals("a", again.get(0).payload());
        assertEquals("b", again.get(1).payload());
        assertNotEquals(first.ackToken(), again.get(0).ackToken());
    }

    @Test
    @DisplayName("Queues are isolated by name")
    void queues_areIsolated() {
        queue.enqueue(QueueNames.scoreUpdates("i1"), "x");

        assertEquals(1, queue.depth("score-updates.i1"));
        assertEquals(0, queue.depth(QueueNames.scoreUpdates("i2")));
    }

    @Test
    @DisplayName("Null messages and blank queue names are rejected")
    void invalidArguments_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> queue.enqueue("q", null));
        assertThrows(IllegalArgumentException.class, () -> queue.enqueue(" ", "a"));
        assertTrue(queue.dequeue("q", 0).isEmpty());
    }
}
