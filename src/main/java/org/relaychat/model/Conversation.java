package org.relaychat.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "conversations")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Conversation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // le type ne change jamais après création : pas de setter, colonne non modifiable
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 10)
    private ConversationKind kind;

    @Setter
    private String name;

    @Setter
    private String description;

    @Column(nullable = false, updatable = false)
    private Long createdBy;

    @Builder.Default
    @Column(nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Setter
    @Builder.Default
    private Instant updatedAt = Instant.now();
}
