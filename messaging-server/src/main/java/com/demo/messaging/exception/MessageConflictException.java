package com.demo.messaging.exception;

/**
 * Two edits of the same message raced for the same history version.
 * Not retried here; the caller decides.
 */
public class MessageConflictException extends MessagingException {

    private final Long messageId;
    private final int version;

    public MessageConflictException(Long messageId, int version, Throwable cause) {
        super("Concurrent edit of message " + messageId + " collided on version " + version, cause);
        this.messageId = messageId;
        this.version = version;
    }

    public Long getMessageId() {
        return messageId;
    }

    public int getVersion() {
        return version;
    }
}
