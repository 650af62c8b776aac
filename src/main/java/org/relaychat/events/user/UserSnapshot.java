package org.relaychat.events.user;

import org.relaychat.model.UserAccount;

import java.time.Instant;

/**
 * Copie complète d'un utilisateur au moment de l'événement.
 */
public record UserSnapshot(
        Long id,
        String username,
        String email,
        String displayName,
        String avatarUrl,
        boolean online,
        Instant lastSeen,
        Instant createdAt,
        Instant updatedAt
) {
    public static UserSnapshot of(UserAccount u) {
        return new UserSnapshot(u.getId(), u.getUsername(), u.getEmail(), u.getDisplayName(),
                u.getAvatarUrl(), u.isOnline(), u.getLastSeen(), u.getCreatedAt(), u.getUpdatedAt());
    }
}
