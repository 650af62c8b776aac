package org.relaychat.dto;

import lombok.*;
import org.relaychat.model.ParticipantRole;

import java.time.Instant;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ParticipantView {
    private Long userId;
    private String username;      // depuis la réplique, null si profil inconnu
    private String displayName;
    private String avatarUrl;
    private boolean online;
    private Instant lastSeen;
    private ParticipantRole role;
    private Instant joinedAt;
}
