package com.demo.messaging.service;

import com.demo.messaging.domain.Message;

/**
 * Hooks the message write path calls explicitly, inside the write's transaction.
 * Implementations are Spring beans and run in {@code @Order} sequence.
 */
public interface MessageLifecycleListener {

    /**
     * Called before a new or existing message is written.
     *
     * @param message  the in-flight message, already carrying the values about to be written
     * @param editorId the acting user, or null when the caller did not name one
     */
    default void beforeSave(Message message, Long editorId) {
    }

    /**
     * Called once, right after a message is first persisted.
     */
    default void afterCreate(Message message) {
    }
}
