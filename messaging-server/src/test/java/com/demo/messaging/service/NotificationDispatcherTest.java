package com.demo.messaging.service;

import com.demo.messaging.domain.Message;
import com.demo.messaging.domain.Notification;
import com.demo.messaging.domain.UserAccount;
import com.demo.messaging.repository.NotificationRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    private NotificationRepository notificationRepository;

    private NotificationDispatcher dispatcher;

    private final UserAccount alice = UserAccount.builder().id(1L).username("alice").build();
    private final UserAccount bob = UserAccount.builder().id(2L).username("bob").build();

    @BeforeEach
    void setUp() {
        dispatcher = new NotificationDispatcher(notificationRepository,
            new MetricsService(new SimpleMeterRegistry()), 50);
    }

    @Test
    void notifiesReceiverWithSenderInTitle() {
        Message message = Message.builder().id(7L).sender(alice).receiver(bob).content("Hello").build();

        dispatcher.afterCreate(message);

        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);
        verify(notificationRepository).save(captor.capture());
        Notification notification = captor.getValue();
        assertThat(notification.getUser()).isSameAs(bob);
        assertThat(notification.getMessage()).isSameAs(message);
        assertThat(notification.getNotificationType()).isEqualTo(Notification.NotificationType.MESSAGE);
        assertThat(notification.isRead()).isFalse();
        assertThat(notification.getTitle()).isEqualTo("New message from alice");
        assertThat(notification.getContent()).isEqualTo("You have received a new message: 'Hello'");
    }

    @Test
    void previewKeepsContentUpToLimit() {
        String fifty = "x".repeat(50);

        assertThat(dispatcher.preview(fifty)).isEqualTo(fifty);
    }

    @Test
    void previewTruncatesLongContent() {
        String content = "This is a very long message content that should be truncated in the notification.";

        assertThat(dispatcher.preview(content)).isEqualTo(content.substring(0, 50) + "...");
    }

    @Test
    void previewDoesNotSplitSurrogatePairs() {
        String content = "a".repeat(49) + "😀" + "tail";

        String preview = dispatcher.preview(content);

        assertThat(preview).isEqualTo("a".repeat(49) + "😀" + "...");
    }
}
