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

/**
 * Append-only snapshot of a message's content taken right before an edit.
 * Versions start at 1 and are contiguous per message.
 */
@Entity
@Table(
    name = "message_history",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_message_history_version", columnNames = {"message_id", "edit_version"})
    },
    indexes = {
        @Index(name = "idx_history_message_edited_at", columnList = "message_id,edited_at"),
        @Index(name = "idx_history_editor_edited_at", columnList = "edited_by_id,edited_at")
    }
)
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @ToString.Include
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "message_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Message message;

    @Column(name = "old_content", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String oldContent;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "edited_by_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private UserAccount editedBy;

    @Column(name = "edited_at", nullable = false, updatable = false)
    private Instant editedAt;

    @Column(name = "edit_version", nullable = false, updatable = false)
    @ToString.Include
    private int version;

    @PrePersist
    protected void onCreate() {
        if (editedAt == null) {
            editedAt = Instant.now();
        }
    }
}
