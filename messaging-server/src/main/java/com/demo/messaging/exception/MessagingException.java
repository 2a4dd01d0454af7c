package com.demo.messaging.exception;

/**
 * Base type for failures the messaging core reports to its callers.
 */
public class MessagingException extends RuntimeException {

    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
