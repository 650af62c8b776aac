package org.relaychat.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Journal d'audit des transitions de statut, en ajout seul.
 */
@Entity
@Table(name = "message_status_events", indexes = {
        @Index(name = "idx_status_event_message_user", columnList = "messageId, userId"),
        @Index(name = "idx_status_event_conversation", columnList = "conversationId, occurred_at")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MessageStatusEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long messageId;

    @Column(nullable = false, updatable = false)
    private Long conversationId;

    @Column(nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private MessageStatus status;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 10)
    private MessageStatus previousStatus;

    @Builder.Default
    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant timestamp = Instant.now();

    @Column(updatable = false)
    private String deviceId;
}
