package com.demo.messaging.service;

import com.demo.messaging.domain.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * New messages always start unread and unedited; a message has no edit
 * history before its first insert.
 */
@Component
@Order(10)
@Slf4j
public class NewMessageStateGuard implements MessageLifecycleListener {

    @Override
    public void beforeSave(Message message, Long editorId) {
        if (!message.isNew()) {
            return;
        }
        if (message.isEdited() || message.getEditedAt() != null) {
            log.debug("New message arrived marked edited, resetting: senderId={}",
                message.getSender().getId());
            message.setEdited(false);
            message.setEditedAt(null);
        }
    }

    @Override
    public void afterCreate(Message message) {
        if (message.isRead()) {
            log.debug("New message arrived marked read, resetting: messageId={}", message.getId());
            message.setRead(false);
        }
    }
}
