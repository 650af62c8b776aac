package org.relaychat.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Ligne de l'outbox : écrite dans la même transaction que la mutation de l'utilisateur,
 * relayée ensuite vers Redis par {@code OutboxRelayService}.
 */
@Entity
@Table(name = "user_events_outbox", indexes = {
        @Index(name = "idx_outbox_pending", columnList = "processed, createdAt"),
        @Index(name = "idx_outbox_subject", columnList = "subjectId")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserEventOutbox {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long subjectId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private UserEventType eventType;

    @Column(nullable = false, length = 8000)
    private String payload;

    private boolean processed;

    @Builder.Default
    @Column(nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    private Instant processedAt;

    // nombre de cycles du relais terminés en échec
    private int attempts;

    @Column(length = 500)
    private String lastError;

    private Instant deadAt;
}
