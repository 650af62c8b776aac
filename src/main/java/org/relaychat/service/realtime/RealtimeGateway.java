package org.relaychat.service.realtime;

import lombok.RequiredArgsConstructor;
import org.relaychat.service.messaging.ConversationService;
import org.relaychat.service.messaging.MessageStatusService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Opérations WebSocket d'une session : connexion, salles, saisie, lecture.
 * Les erreurs métier sont renvoyées à la session sous forme d'événement {@code error}.
 */
@Service
@RequiredArgsConstructor
public class RealtimeGateway {

    private static final Logger log = LoggerFactory.getLogger(RealtimeGateway.class);

    public static final String ERROR_EVENT = "error";
    public static final String TYPING_USERS_EVENT = "typing_users";

    private final SessionRegistry registry;
    private final SessionPusher pusher;
    private final PresenceService presence;
    private final ConversationService conversationService;
    private final MessageStatusService statusService;

    public void onConnect(String sessionId, Long userId) {
        registry.register(sessionId, userId);
        presence.setOnline(userId, sessionId);
        log.info("Session {} ouverte pour {}", sessionId, userId);
    }

    public void onDisconnect(String sessionId) {
        registry.unregister(sessionId).ifPresent(removed -> {
            if (removed.roomId() != null) {
                presence.stopTyping(removed.userId(), removed.roomId());
            }
            // hors ligne seulement quand la dernière session locale de l'utilisateur se ferme
            if (removed.lastSessionOfUser()) {
                presence.setOffline(removed.userId());
            }
            log.info("Session {} fermée pour {}", sessionId, removed.userId());
        });
    }

    public boolean joinConversation(String sessionId, Long userId, Long conversationId) {
        if (conversationId == null) {
            sendError(sessionId, "conversationId requis");
            return false;
        }
        boolean allowed;
        try {
            allowed = conversationService.isParticipant(conversationId, userId);
        } catch (RuntimeException e) {
            log.warn("Vérification de participation impossible ({} dans {}): {}", userId, conversationId, e.getMessage());
            allowed = false;
        }
        if (!allowed) {
            sendError(sessionId, "Accès refusé à la conversation " + conversationId);
            return false;
        }
        registry.joinRoom(sessionId, conversationId)
                .ifPresent(previous -> presence.stopTyping(userId, previous));

        Set<Long> typing = new TreeSet<>(presence.typingUsers(conversationId));
        typing.remove(userId);
        safePush(sessionId, TYPING_USERS_EVENT, Map.of("conversationId", conversationId, "userIds", typing));
        return true;
    }

    public void leaveConversation(String sessionId, Long userId, Long conversationId) {
        if (conversationId != null && registry.leaveRoom(sessionId, conversationId)) {
            presence.stopTyping(userId, conversationId);
        }
    }

    public void typingStart(String sessionId, Long userId, Long conversationId) {
        if (inRoom(sessionId, conversationId)) {
            presence.setTyping(userId, conversationId);
        }
    }

    public void typingStop(String sessionId, Long userId, Long conversationId) {
        if (inRoom(sessionId, conversationId)) {
            presence.stopTyping(userId, conversationId);
        }
    }

    public void markRead(String sessionId, Long userId, Long conversationId) {
        try {
            statusService.markConversationRead(conversationId, userId, null);
        } catch (RuntimeException e) {
            sendError(sessionId, e.getMessage());
        }
    }

    public GatewayStatus status() {
        return new GatewayStatus(registry.sessionCount(), registry.userCount(), registry.roomSizes());
    }

    public void sendError(String sessionId, String message) {
        safePush(sessionId, ERROR_EVENT, Map.of("message", message == null ? "Erreur" : message));
    }

    private boolean inRoom(String sessionId, Long conversationId) {
        return conversationId != null && registry.currentRoom(sessionId).map(conversationId::equals).orElse(false);
    }

    private void safePush(String sessionId, String event, Object data) {
        try {
            pusher.push(sessionId, event, data);
        } catch (RuntimeException e) {
            log.warn("Envoi {} à la session {} échoué: {}", event, sessionId, e.getMessage());
        }
    }
}
