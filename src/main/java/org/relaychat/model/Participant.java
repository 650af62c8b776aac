package org.relaychat.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "conversation_participants",
        uniqueConstraints = @UniqueConstraint(name = "uk_participant", columnNames = {"conversationId", "userId"}),
        indexes = @Index(name = "idx_participant_user", columnList = "userId"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Participant {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long conversationId;

    @Column(nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private ParticipantRole role = ParticipantRole.MEMBER;

    @Builder.Default
    private Instant joinedAt = Instant.now();

    // pointeur de lecture, uniquement vers l'avant (voir ParticipantRepository.advanceReadPointer)
    private Long lastReadMessageId;

    private Instant lastReadAt;
}
