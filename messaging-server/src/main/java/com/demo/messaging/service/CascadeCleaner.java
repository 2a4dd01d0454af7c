package com.demo.messaging.service;

import com.demo.messaging.domain.CleanupReport;
import com.demo.messaging.repository.MessageHistoryRepository;
import com.demo.messaging.repository.MessageRepository;
import com.demo.messaging.repository.NotificationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.IntSupplier;

/**
 * Second pass after a user is deleted.
 *
 * Foreign keys already cascade the delete; this re-checks every table that
 * references users and removes whatever is left. Each step commits on its own
 * and a failing step is logged and skipped, so the user deletion itself is
 * never undone by cleanup.
 */
@Component
@Slf4j
public class CascadeCleaner {

    private final MessageRepository messageRepository;
    private final MessageHistoryRepository historyRepository;
    private final NotificationRepository notificationRepository;
    private final TransactionTemplate transactionTemplate;
    private final MetricsService metricsService;

    public CascadeCleaner(MessageRepository messageRepository,
                          MessageHistoryRepository historyRepository,
                          NotificationRepository notificationRepository,
                          @Qualifier("requiresNewTransactionTemplate") TransactionTemplate transactionTemplate,
                          MetricsService metricsService) {
        this.messageRepository = messageRepository;
        this.historyRepository = historyRepository;
        this.notificationRepository = notificationRepository;
        this.transactionTemplate = transactionTemplate;
        this.metricsService = metricsService;
    }

    public CleanupReport afterUserDeleted(Long userId) {
        CleanupReport report = CleanupReport.builder().userId(userId).build();

        report.setMessagesRemoved(runStep("messages", userId, report,
            () -> messageRepository.deleteBySenderOrReceiver(userId)));
        report.setHistoriesRemoved(runStep("message_history", userId, report,
            () -> historyRepository.deleteByEditor(userId)));
        report.setNotificationsRemoved(runStep("notifications", userId, report,
            () -> notificationRepository.deleteByUser(userId)));

        log.info("Cleanup finished: userId={}, messages={}, histories={}, notifications={}, failedSteps={}",
            userId, report.getMessagesRemoved(), report.getHistoriesRemoved(),
            report.getNotificationsRemoved(), report.getFailedSteps());
        return report;
    }

    private int runStep(String step, Long userId, CleanupReport report, IntSupplier delete) {
        try {
            Integer removed = transactionTemplate.execute(status -> delete.getAsInt());
            int count = removed != null ? removed : 0;
            if (count > 0) {
                log.warn("Cascade left rows behind: step={}, userId={}, removed={}", step, userId, count);
            }
            return count;
        } catch (Exception e) {
            log.error("Cleanup step failed: step={}, userId={}", step, userId, e);
            metricsService.recordCleanupFailure(step);
            report.setFailedSteps(report.getFailedSteps() + 1);
            return 0;
        }
    }
}
