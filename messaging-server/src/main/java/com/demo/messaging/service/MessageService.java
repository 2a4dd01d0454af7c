package com.demo.messaging.service;

import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.MessageHistory;
import com.demo.messaging.domain.UserAccount;
import com.demo.messaging.domain.ValidationResult;
import com.demo.messaging.exception.MessageNotFoundException;
import com.demo.messaging.exception.MessagePermissionDeniedException;
import com.demo.messaging.repository.MessageHistoryRepository;
import com.demo.messaging.repository.MessageRepository;
import com.demo.messaging.repository.UserAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Write path for messages.
 *
 * Every write runs the registered {@link MessageLifecycleListener}s itself, in order,
 * inside its own transaction: {@code beforeSave} for creates and updates,
 * {@code afterCreate} only after the first insert.
 */
@Service
@Slf4j
public class MessageService {

    private final MessageRepository messageRepository;
    private final MessageHistoryRepository historyRepository;
    private final UserAccountRepository userRepository;
    private final List<MessageLifecycleListener> listeners;
    private final MetricsService metricsService;

    // Optional: Kafka event publisher (null if Kafka is disabled)
    private final EventPublisher eventPublisher;

    public MessageService(MessageRepository messageRepository,
                          MessageHistoryRepository historyRepository,
                          UserAccountRepository userRepository,
                          List<MessageLifecycleListener> listeners,
                          MetricsService metricsService,
                          @Autowired(required = false) EventPublisher eventPublisher) {
        this.messageRepository = messageRepository;
        this.historyRepository = historyRepository;
        this.userRepository = userRepository;
        this.listeners = List.copyOf(listeners);
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;

        log.info("Message write path initialized with {} lifecycle listeners", this.listeners.size());
    }

    /**
     * Send a message, optionally as a reply to {@code parentMessageId}.
     */
    @Transactional
    public Message send(Long senderId, Long receiverId, String content, Long parentMessageId) {
        validateSend(senderId, receiverId, content).throwIfInvalid();

        UserAccount sender = findUser(senderId);
        UserAccount receiver = findUser(receiverId);

        Message parent = null;
        if (parentMessageId != null) {
            parent = messageRepository.findWithParticipantsById(parentMessageId)
                .orElseThrow(() -> MessageNotFoundException.message(parentMessageId));
            if (!parent.isParticipant(senderId)) {
                throw new MessagePermissionDeniedException(parentMessageId, senderId, "reply to");
            }
        }

        Message draft = Message.builder()
            .sender(sender)
            .receiver(receiver)
            .parentMessage(parent)
            .content(content)
            .build();

        return create(draft);
    }

    /**
     * Persist a message that has not been stored yet. The sender, receiver and
     * parent it references are looked up again by id and must exist.
     */
    @Transactional
    public Message create(Message draft) {
        if (!draft.isNew()) {
            throw new IllegalArgumentException("Message already persisted: id=" + draft.getId());
        }
        validateDraft(draft).throwIfInvalid();

        draft.setSender(findUser(draft.getSender().getId()));
        draft.setReceiver(findUser(draft.getReceiver().getId()));
        if (draft.getParentMessage() != null) {
            Long parentId = draft.getParentMessage().getId();
            draft.setParentMessage(messageRepository.findById(parentId)
                .orElseThrow(() -> MessageNotFoundException.message(parentId)));
        }

        listeners.forEach(listener -> listener.beforeSave(draft, null));
        Message saved = messageRepository.save(draft);
        listeners.forEach(listener -> listener.afterCreate(saved));

        metricsService.recordMessageSent(saved.getParentMessage() != null);
        log.info("Message created: messageId={}, senderId={}, receiverId={}, parentId={}",
            saved.getId(), saved.getSender().getId(), saved.getReceiver().getId(), saved.getParentMessageId());

        if (eventPublisher != null) {
            eventPublisher.publishMessageCreated(saved);
        }
        return saved;
    }

    /**
     * Replace the content of a message. The row stays locked until commit so
     * concurrent edits of the same message apply one after the other.
     *
     * @param editorId acting user; when null the sender is credited with the edit
     */
    @Transactional
    public Message edit(Long messageId, String newContent, Long editorId) {
        validateContent(newContent).throwIfInvalid();

        Message message = messageRepository.findByIdForUpdate(messageId)
            .orElseThrow(() -> MessageNotFoundException.message(messageId));
        if (editorId != null && !message.isParticipant(editorId)) {
            throw new MessagePermissionDeniedException(messageId, editorId, "edit");
        }

        Instant previousEdit = message.getEditedAt();
        message.setContent(newContent);
        listeners.forEach(listener -> listener.beforeSave(message, editorId));
        Message saved = messageRepository.save(message);

        if (!Objects.equals(previousEdit, saved.getEditedAt())) {
            log.info("Message edited: messageId={}, editorId={}", messageId, editorId);
            if (eventPublisher != null) {
                eventPublisher.publishMessageEdited(saved, editorId);
            }
        } else {
            log.debug("Edit left content unchanged: messageId={}", messageId);
        }
        return saved;
    }

    /**
     * Mark a single message read on behalf of its receiver.
     *
     * @return true if the message changed state
     */
    @Transactional
    public boolean markAsRead(Long messageId, Long actorId) {
        Message message = messageRepository.findByIdForUpdate(messageId)
            .orElseThrow(() -> MessageNotFoundException.message(messageId));
        if (!Objects.equals(message.getReceiver().getId(), actorId)) {
            throw new MessagePermissionDeniedException(messageId, actorId, "mark as read");
        }
        if (message.isRead()) {
            return false;
        }

        message.setRead(true);
        listeners.forEach(listener -> listener.beforeSave(message, actorId));
        messageRepository.save(message);
        metricsService.recordMessagesRead(1);
        return true;
    }

    /**
     * Delete a message. Replies, edit history and notifications go with it.
     */
    @Transactional
    public void delete(Long messageId, Long actorId) {
        Message message = messageRepository.findById(messageId)
            .orElseThrow(() -> MessageNotFoundException.message(messageId));
        if (!message.isParticipant(actorId)) {
            throw new MessagePermissionDeniedException(messageId, actorId, "delete");
        }

        messageRepository.delete(message);
        metricsService.recordMessageDeleted();
        log.info("Message deleted: messageId={}, actorId={}", messageId, actorId);

        if (eventPublisher != null) {
            eventPublisher.publishMessageDeleted(messageId, actorId);
        }
    }

    @Transactional(readOnly = true)
    public Message getMessage(Long messageId) {
        return messageRepository.findWithParticipantsById(messageId)
            .orElseThrow(() -> MessageNotFoundException.message(messageId));
    }

    /**
     * Edit history of a message, version 1 first.
     */
    @Transactional(readOnly = true)
    public List<MessageHistory> getHistory(Long messageId) {
        if (!messageRepository.existsById(messageId)) {
            throw MessageNotFoundException.message(messageId);
        }
        return historyRepository.findAllByMessageIdOrderByVersion(messageId);
    }

    private ValidationResult validateSend(Long senderId, Long receiverId, String content) {
        List<String> errors = new ArrayList<>();
        if (senderId == null) {
            errors.add("sender is required");
        }
        if (receiverId == null) {
            errors.add("receiver is required");
        }
        errors.addAll(validateContent(content).getErrors());
        return ValidationResult.of(errors);
    }

    private UserAccount findUser(Long userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> MessageNotFoundException.user(userId));
    }

    private ValidationResult validateDraft(Message draft) {
        List<String> errors = new ArrayList<>();
        if (draft.getSender() == null || draft.getSender().getId() == null) {
            errors.add("sender is required");
        }
        if (draft.getReceiver() == null || draft.getReceiver().getId() == null) {
            errors.add("receiver is required");
        }
        if (draft.getParentMessage() != null && draft.getParentMessage().getId() == null) {
            errors.add("parent message must be stored first");
        }
        errors.addAll(validateContent(draft.getContent()).getErrors());
        return ValidationResult.of(errors);
    }

    private ValidationResult validateContent(String content) {
        if (content == null || content.isBlank()) {
            return ValidationResult.of(List.of("content must not be empty"));
        }
        return ValidationResult.success();
    }
}
