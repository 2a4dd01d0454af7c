package com.demo.messaging.exception;

public class MessageNotFoundException extends MessagingException {

    private final String resource;
    private final Long resourceId;

    public MessageNotFoundException(String resource, Long resourceId) {
        super(resource + " not found: id=" + resourceId);
        this.resource = resource;
        this.resourceId = resourceId;
    }

    public static MessageNotFoundException message(Long messageId) {
        return new MessageNotFoundException("Message", messageId);
    }

    public static MessageNotFoundException user(Long userId) {
        return new MessageNotFoundException("User", userId);
    }

    public static MessageNotFoundException notification(Long notificationId) {
        return new MessageNotFoundException("Notification", notificationId);
    }

    public String getResource() {
        return resource;
    }

    public Long getResourceId() {
        return resourceId;
    }
}
