package com.demo.messaging.service;

import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.MessageHistory;
import com.demo.messaging.domain.UserAccount;
import com.demo.messaging.exception.MessageConflictException;
import com.demo.messaging.exception.MessageNotFoundException;
import com.demo.messaging.repository.MessageHistoryRepository;
import com.demo.messaging.repository.MessageRepository;
import com.demo.messaging.repository.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Records the stored content of a message as a new history version
 * whenever a write is about to change it.
 */
@Component
@Order(0)
@Slf4j
public class MessageEditInterceptor implements MessageLifecycleListener {

    private final MessageRepository messageRepository;
    private final MessageHistoryRepository historyRepository;
    private final UserAccountRepository userRepository;
    private final MetricsService metricsService;

    public MessageEditInterceptor(MessageRepository messageRepository,
                                  MessageHistoryRepository historyRepository,
                                  UserAccountRepository userRepository,
                                  MetricsService metricsService) {
        this.messageRepository = messageRepository;
        this.historyRepository = historyRepository;
        this.userRepository = userRepository;
        this.metricsService = metricsService;
    }

    @Override
    public void beforeSave(Message message, Long editorId) {
        if (message.isNew()) {
            return;
        }

        Long messageId = message.getId();
        Optional<String> persisted = messageRepository.findPersistedContentById(messageId);
        if (persisted.isEmpty()) {
            // Deleted concurrently; nothing to snapshot
            log.debug("No stored state for message, skipping history: messageId={}", messageId);
            return;
        }

        String oldContent = persisted.get();
        if (Objects.equals(oldContent, message.getContent())) {
            return;
        }

        int version = historyRepository.findMaxVersionByMessageId(messageId).orElse(0) + 1;
        Instant now = Instant.now();

        MessageHistory entry = MessageHistory.builder()
            .message(message)
            .oldContent(oldContent)
            .editedBy(resolveEditor(message, editorId))
            .editedAt(now)
            .version(version)
            .build();

        message.markEdited(now);

        try {
            historyRepository.saveAndFlush(entry);
        } catch (DataIntegrityViolationException e) {
            log.warn("Edit conflict: messageId={}, version={}", messageId, version);
            metricsService.recordEditConflict();
            throw new MessageConflictException(messageId, version, e);
        }

        metricsService.recordMessageEdited(version);
        log.debug("History recorded: messageId={}, version={}, editorId={}",
            messageId, version, entry.getEditedBy().getId());
    }

    /**
     * Without an explicit editor the sender is credited with the edit.
     */
    private UserAccount resolveEditor(Message message, Long editorId) {
        if (editorId == null) {
            return message.getSender();
        }
        return userRepository.findById(editorId)
            .orElseThrow(() -> MessageNotFoundException.user(editorId));
    }
}
