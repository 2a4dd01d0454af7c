package com.demo.messaging.service;

import com.demo.messaging.domain.Message;
import com.demo.messaging.repository.MessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Unread views over the messages a user received.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UnreadMessageService {

    private final MessageRepository messageRepository;
    private final MetricsService metricsService;

    /**
     * Unread received messages, newest first, with the sender loaded.
     */
    @Transactional(readOnly = true)
    public List<Message> unreadFor(Long userId) {
        return messageRepository.findUnreadForReceiver(userId);
    }

    @Transactional(readOnly = true)
    public long unreadCount(Long userId) {
        return messageRepository.countUnreadForReceiver(userId);
    }

    /**
     * Mark the user's unread messages read. A null or empty {@code messageIds}
     * means all of them; ids that are not the user's unread messages are skipped.
     *
     * @return number of messages that changed state
     */
    @Transactional
    public int markRead(Long userId, Collection<Long> messageIds) {
        int updated;
        if (messageIds == null || messageIds.isEmpty()) {
            updated = messageRepository.markAllReadForReceiver(userId);
        } else {
            updated = messageRepository.markReadForReceiver(userId, messageIds);
        }

        metricsService.recordMessagesRead(updated);
        log.debug("Marked read: userId={}, requested={}, updated={}",
            userId, messageIds == null ? "all" : messageIds.size(), updated);
        return updated;
    }

    @Transactional
    public int markAllRead(Long userId) {
        return markRead(userId, null);
    }
}
