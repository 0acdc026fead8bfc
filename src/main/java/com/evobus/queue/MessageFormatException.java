package com.evobus.queue;

/**
 * A queue payload that cannot be encoded or decoded. Redelivering it will not help.
 */
public class MessageFormatException extends RuntimeException {

    public MessageFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public MessageFormatException(String message) {
        super(message);
    }
}
