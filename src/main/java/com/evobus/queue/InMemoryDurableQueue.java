package com.evobus.queue;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryDurableQueue implements DurableQueue {

    private final ConcurrentHashMap<String, QueueState> queues = new ConcurrentHashMap<>();

    @Override
    public void enqueue(String queue, String message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        QueueState state = state(queue);
        synchronized (state) {
            state.pending.addLast(message);
        }
    }

    @Override
    public List<QueueMessage> dequeue(String queue, int maxBatch) {
        if (maxBatch <= 0) {
            return Collections.emptyList();
        }
        QueueState state = state(queue);
        List<QueueMessage> claimed = new ArrayList<>();
        synchronized (state) {
            while (claimed.size() < maxBatch && !state.pending.isEmpty()) {
                String payload = state.pending.pollFirst();
                String token = UUID.randomUUID().toString();
                state.inFlight.put(token, payload);
                claimed.add(new QueueMessage(token, payload));
            }
        }
        return claimed;
    }

    @Override
    public void ack(String queue, String ackToken) {
        QueueState state = state(queue);
        synchronized (state) {
            state.inFlight.remove(ackToken);
        }
    }

    @Override
    public void nack(String queue, String ackToken) {
        QueueState state = state(queue);
        synchronized (state) {
            String payload = state.inFlight.remove(ackToken);
            if (payload != null) {
                state.pending.addFirst(payload);
            }
        }
    }

    @Override
    public int depth(String queue) {
        QueueState state = state(queue);
        synchronized (state) {
            return state.pending.size();
        }
    }

    public int inFlight(String queue) {
        QueueState state = state(queue);
        synchronized (state) {
            return state.inFlight.size();
        }
    }

    private QueueState state(String queue) {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("queue name is required");
        }
        return queues.computeIfAbsent(queue, q -> new QueueState());
    }

    private static final class QueueState {
        private final Deque<String> pending = new ArrayDeque<>();
        private final Map<String, String> inFlight = new LinkedHashMap<>();
    }
}
