package com.demo.messaging.service;

import com.demo.messaging.domain.CleanupReport;
import com.demo.messaging.domain.UserAccount;
import com.demo.messaging.domain.UserDeletionStats;
import com.demo.messaging.domain.ValidationResult;
import com.demo.messaging.exception.MessageNotFoundException;
import com.demo.messaging.repository.MessageHistoryRepository;
import com.demo.messaging.repository.MessageRepository;
import com.demo.messaging.repository.NotificationRepository;
import com.demo.messaging.repository.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * User references and account deletion.
 */
@Service
@Slf4j
public class UserAccountService {

    private final UserAccountRepository userRepository;
    private final MessageRepository messageRepository;
    private final MessageHistoryRepository historyRepository;
    private final NotificationRepository notificationRepository;
    private final CascadeCleaner cascadeCleaner;
    private final TransactionTemplate transactionTemplate;
    private final MetricsService metricsService;
    private final EventPublisher eventPublisher;

    public UserAccountService(UserAccountRepository userRepository,
                              MessageRepository messageRepository,
                              MessageHistoryRepository historyRepository,
                              NotificationRepository notificationRepository,
                              CascadeCleaner cascadeCleaner,
                              @Qualifier("requiresNewTransactionTemplate") TransactionTemplate transactionTemplate,
                              MetricsService metricsService,
                              @Autowired(required = false) EventPublisher eventPublisher) {
        this.userRepository = userRepository;
        this.messageRepository = messageRepository;
        this.historyRepository = historyRepository;
        this.notificationRepository = notificationRepository;
        this.cascadeCleaner = cascadeCleaner;
        this.transactionTemplate = transactionTemplate;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
    }

    @Transactional
    public UserAccount register(String username, String email) {
        List<String> errors = new ArrayList<>();
        if (username == null || username.isBlank()) {
            errors.add("username is required");
        } else if (userRepository.existsByUsername(username)) {
            errors.add("username already taken: " + username);
        }
        ValidationResult.of(errors).throwIfInvalid();

        UserAccount user = userRepository.save(UserAccount.builder()
            .username(username)
            .email(email)
            .build());
        log.info("User registered: userId={}, username={}", user.getId(), username);
        return user;
    }

    @Transactional(readOnly = true)
    public UserAccount getUser(Long userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> MessageNotFoundException.user(userId));
    }

    /**
     * What deleting the account would remove.
     */
    @Transactional(readOnly = true)
    public UserDeletionStats deletionStats(Long userId) {
        UserAccount user = getUser(userId);

        long sent = messageRepository.countBySender(userId);
        long received = messageRepository.countByReceiver(userId);
        long notifications = notificationRepository.countByUser(userId);
        long histories = historyRepository.countByEditor(userId);

        return UserDeletionStats.builder()
            .userId(userId)
            .username(user.getUsername())
            .sentMessages(sent)
            .receivedMessages(received)
            .totalMessages(sent + received)
            .notifications(notifications)
            .messageHistories(histories)
            .totalDataPoints(sent + received + notifications + histories)
            .build();
    }

    /**
     * Delete a user. The deletion commits first and cascades through the
     * foreign keys; the cleanup pass runs afterwards and cannot roll it back.
     */
    public CleanupReport deleteAccount(Long userId) {
        UserAccount deleted = transactionTemplate.execute(status -> {
            UserAccount user = userRepository.findById(userId)
                .orElseThrow(() -> MessageNotFoundException.user(userId));
            userRepository.delete(user);
            return user;
        });

        log.info("User deleted: userId={}, username={}", userId, deleted.getUsername());
        metricsService.recordUserDeleted();

        CleanupReport report = cascadeCleaner.afterUserDeleted(userId);

        if (eventPublisher != null) {
            eventPublisher.publishUserDeleted(userId, deleted.getUsername());
        }
        return report;
    }
}
