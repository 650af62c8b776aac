package org.relaychat.dto;

import org.relaychat.model.MessageStatus;

import java.time.Instant;
import java.util.List;

public record StatusSyncResult(boolean success, int processedCount, int failedCount,
                               List<Conflict> conflicts, List<ServerUpdate> serverUpdates) {

    /** resolved : le serveur a gardé son statut plus avancé ; sinon c'est au client de trancher. */
    public record Conflict(Long messageId, MessageStatus serverStatus, MessageStatus clientStatus, boolean resolved) {
    }

    public record ServerUpdate(Long messageId, Long conversationId, Long userId, MessageStatus status, Instant timestamp) {
    }
}
