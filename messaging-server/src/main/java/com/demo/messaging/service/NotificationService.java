package com.demo.messaging.service;

import com.demo.messaging.domain.Notification;
import com.demo.messaging.domain.UserAccount;
import com.demo.messaging.domain.ValidationResult;
import com.demo.messaging.exception.MessageNotFoundException;
import com.demo.messaging.repository.NotificationRepository;
import com.demo.messaging.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationService {

    static final int MAX_TITLE_LENGTH = 200;

    private final NotificationRepository notificationRepository;
    private final UserAccountRepository userRepository;
    private final MetricsService metricsService;

    /**
     * Notification that is not tied to any message.
     */
    @Transactional
    public Notification createSystemNotification(Long userId, String title, String content) {
        List<String> errors = new ArrayList<>();
        if (title == null || title.isBlank()) {
            errors.add("title is required");
        } else if (title.length() > MAX_TITLE_LENGTH) {
            errors.add("title longer than " + MAX_TITLE_LENGTH + " characters");
        }
        if (content == null) {
            errors.add("content is required");
        }
        ValidationResult.of(errors).throwIfInvalid();

        UserAccount user = userRepository.findById(userId)
            .orElseThrow(() -> MessageNotFoundException.user(userId));

        Notification notification = notificationRepository.save(Notification.builder()
            .user(user)
            .notificationType(Notification.NotificationType.SYSTEM)
            .title(title)
            .content(content)
            .build());

        metricsService.recordNotificationCreated(Notification.NotificationType.SYSTEM.name());
        log.info("System notification created: notificationId={}, userId={}", notification.getId(), userId);
        return notification;
    }

    @Transactional(readOnly = true)
    public List<Notification> listFor(Long userId) {
        return notificationRepository.findByUserNewestFirst(userId);
    }

    @Transactional(readOnly = true)
    public long unreadCount(Long userId) {
        return notificationRepository.countUnreadByUser(userId);
    }

    /**
     * @return true if the notification changed state
     */
    @Transactional
    public boolean markRead(Long notificationId) {
        Notification notification = notificationRepository.findById(notificationId)
            .orElseThrow(() -> MessageNotFoundException.notification(notificationId));
        if (notification.isRead()) {
            return false;
        }
        notification.setRead(true);
        return true;
    }

    /**
     * @return number of notifications that changed state
     */
    @Transactional
    public int markAllRead(Long userId) {
        int updated = notificationRepository.markAllReadByUser(userId);
        log.debug("Notifications marked read: userId={}, updated={}", userId, updated);
        return updated;
    }
}
