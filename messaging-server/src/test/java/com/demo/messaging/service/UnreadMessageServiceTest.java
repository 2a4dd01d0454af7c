package com.demo.messaging.service;

import com.demo.messaging.MessagingIntegrationTest;
import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.UserAccount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UnreadMessageServiceTest extends MessagingIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-03-01T08:00:00Z");

    @Autowired
    private UnreadMessageService unreadMessageService;

    private UserAccount reader;
    private UserAccount writer;

    @BeforeEach
    void setUp() {
        reader = user("reader");
        writer = user("writer");
    }

    @Test
    void unreadMessagesComeNewestFirstWithCountMatching() {
        Message oldest = post(writer, reader, "one", T0);
        Message newest = post(writer, reader, "three", T0.plusSeconds(120));
        Message middle = post(writer, reader, "two", T0.plusSeconds(60));
        post(reader, writer, "outgoing", T0.plusSeconds(30));

        List<Message> unread = unreadMessageService.unreadFor(reader.getId());

        assertThat(unread).extracting(Message::getId)
            .containsExactly(newest.getId(), middle.getId(), oldest.getId());
        assertThat(unread.get(0).getSender().getUsername()).isEqualTo("writer");
        assertThat(unreadMessageService.unreadCount(reader.getId())).isEqualTo(unread.size());
    }

    @Test
    void markingSubsetSkipsMessagesOfOtherReceivers() {
        Message first = post(writer, reader, "one", T0);
        Message second = post(writer, reader, "two", T0.plusSeconds(1));
        Message third = post(writer, reader, "three", T0.plusSeconds(2));
        Message foreign = post(reader, writer, "not yours", T0.plusSeconds(3));

        int updated = unreadMessageService.markRead(reader.getId(), List.of(first.getId(), second.getId(), foreign.getId()));

        assertThat(updated).isEqualTo(2);
        assertThat(unreadMessageService.unreadFor(reader.getId())).extracting(Message::getId)
            .containsExactly(third.getId());
        assertThat(unreadMessageService.unreadCount(writer.getId())).isEqualTo(1);
    }

    @Test
    void markingAlreadyReadMessagesUpdatesNothing() {
        Message message = post(writer, reader, "one", T0);
        unreadMessageService.markRead(reader.getId(), List.of(message.getId()));

        assertThat(unreadMessageService.markRead(reader.getId(), List.of(message.getId()))).isZero();
    }

    @Test
    void nullOrEmptySelectionMarksEverything() {
        post(writer, reader, "one", T0);
        post(writer, reader, "two", T0.plusSeconds(1));

        assertThat(unreadMessageService.markRead(reader.getId(), List.of())).isEqualTo(2);
        assertThat(unreadMessageService.unreadCount(reader.getId())).isZero();

        post(writer, reader, "three", T0.plusSeconds(2));
        assertThat(unreadMessageService.markAllRead(reader.getId())).isEqualTo(1);
        assertThat(unreadMessageService.unreadFor(reader.getId())).isEmpty();
    }

    @Test
    void unknownUserHasNothingUnread() {
        assertThat(unreadMessageService.unreadFor(999_999L)).isEmpty();
        assertThat(unreadMessageService.unreadCount(999_999L)).isZero();
        assertThat(unreadMessageService.markAllRead(999_999L)).isZero();
    }

    @Test
    void markingReadDoesNotTouchEditState() {
        Message message = post(writer, reader, "one", T0);

        unreadMessageService.markAllRead(reader.getId());

        Message stored = messageService.getMessage(message.getId());
        assertThat(stored.isRead()).isTrue();
        assertThat(stored.isEdited()).isFalse();
        assertThat(historyRepository.countByMessage(message.getId())).isZero();
    }

    private Message post(UserAccount sender, UserAccount receiver, String content, Instant at) {
        return messageService.create(Message.builder()
            .sender(sender)
            .receiver(receiver)
            .content(content)
            .timestamp(at)
            .build());
    }
}
