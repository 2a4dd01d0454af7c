package com.demo.messaging.exception;

public class MessagePermissionDeniedException extends MessagingException {

    private final Long messageId;
    private final Long actorId;

    public MessagePermissionDeniedException(Long messageId, Long actorId, String action) {
        super("User " + actorId + " may not " + action + " message " + messageId);
        this.messageId = messageId;
        this.actorId = actorId;
    }

    public Long getMessageId() {
        return messageId;
    }

    public Long getActorId() {
        return actorId;
    }
}
