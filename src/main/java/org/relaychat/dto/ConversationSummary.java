package org.relaychat.dto;

import lombok.*;
import org.relaychat.model.ConversationKind;

import java.time.Instant;
import java.util.List;

/**
 * Ligne de la liste des conversations, telle que mise en cache sous {@code conversation-list:{userId}}.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ConversationSummary {
    private Long id;
    private ConversationKind kind;
    private String name;
    private String description;
    private Long createdBy;
    private Instant createdAt;
    private Instant updatedAt;
    private List<ParticipantView> participants;
    private MessageView lastMessage;
    private long unreadCount;
    private Instant lastActivity;
}
