package com.jobbus;

/**
 * Raised when the broker rejects or cannot complete an operation.
 */
public class MessageBusException extends RuntimeException {

    public MessageBusException(String message) {
        super(message);
    }

    public MessageBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
