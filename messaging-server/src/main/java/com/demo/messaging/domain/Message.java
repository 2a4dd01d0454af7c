package com.demo.messaging.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.util.Objects;

/**
 * Direct message between two users.
 *
 * Replies point at their parent through {@code parentMessage}; deleting a message
 * removes its replies, edit history and notifications at the database level.
 * {@code edited} is true iff at least one {@link MessageHistory} row exists.
 */
@Entity
@Table(name = "messages", indexes = {
    @Index(name = "idx_messages_receiver_read", columnList = "receiver_id,is_read"),
    @Index(name = "idx_messages_sender", columnList = "sender_id"),
    @Index(name = "idx_messages_parent_sent_at", columnList = "parent_message_id,sent_at")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sender_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private UserAccount sender;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "receiver_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private UserAccount receiver;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_message_id")
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Message parentMessage;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "sent_at", nullable = false, updatable = false)
    @ToString.Include
    private Instant timestamp;

    @Column(name = "is_read", nullable = false)
    @Builder.Default
    private boolean read = false;

    @Column(nullable = false)
    @ToString.Include
    private boolean edited;

    @Column(name = "edited_at")
    private Instant editedAt;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean isNew() {
        return id == null;
    }

    public Long getParentMessageId() {
        return parentMessage != null ? parentMessage.getId() : null;
    }

    /**
     * Only the sender and the receiver may act on a message.
     */
    public boolean isParticipant(Long userId) {
        if (userId == null) {
            return false;
        }
        return Objects.equals(userId, sender.getId()) || Objects.equals(userId, receiver.getId());
    }

    public void markEdited(Instant when) {
        this.edited = true;
        this.editedAt = when;
    }
}
