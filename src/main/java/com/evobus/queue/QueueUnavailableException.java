package com.evobus.queue;

public class QueueUnavailableException extends RuntimeException {

    public QueueUnavailableException(String queue, Throwable cause) {
        super("queue unavailable: " + queue, cause);
    }

    public QueueUnavailableException(String message) {
        super(message);
    }
}
