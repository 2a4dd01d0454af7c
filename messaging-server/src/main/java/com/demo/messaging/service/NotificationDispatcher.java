package com.demo.messaging.service;

import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.Notification;
import com.demo.messaging.repository.NotificationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Creates the receiver's notification for every newly created message.
 * Edits never reach this listener, so each message is announced exactly once.
 */
@Component
@Order(20)
@Slf4j
public class NotificationDispatcher implements MessageLifecycleListener {

    static final String ELLIPSIS = "...";

    private final NotificationRepository notificationRepository;
    private final MetricsService metricsService;
    private final int previewLength;

    public NotificationDispatcher(NotificationRepository notificationRepository,
                                  MetricsService metricsService,
                                  @Value("${messaging.notification.preview-length:50}") int previewLength) {
        this.notificationRepository = notificationRepository;
        this.metricsService = metricsService;
        this.previewLength = previewLength;
    }

    @Override
    public void afterCreate(Message message) {
        Notification notification = Notification.builder()
            .user(message.getReceiver())
            .message(message)
            .notificationType(Notification.NotificationType.MESSAGE)
            .title(buildTitle(message))
            .content(buildContent(message))
            .build();

        notificationRepository.save(notification);
        metricsService.recordNotificationCreated(Notification.NotificationType.MESSAGE.name());

        log.debug("Notification created: notificationId={}, messageId={}, userId={}",
            notification.getId(), message.getId(), message.getReceiver().getId());
    }

    String buildTitle(Message message) {
        return "New message from " + message.getSender().getUsername();
    }

    String buildContent(Message message) {
        return "You have received a new message: '" + preview(message.getContent()) + "'";
    }

    /**
     * First {@code previewLength} code points, with an ellipsis when anything was cut.
     */
    String preview(String content) {
        if (content.codePointCount(0, content.length()) <= previewLength) {
            return content;
        }
        return content.substring(0, content.offsetByCodePoints(0, previewLength)) + ELLIPSIS;
    }
}
