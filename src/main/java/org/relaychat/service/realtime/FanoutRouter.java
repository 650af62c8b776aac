package org.relaychat.service.realtime;

import lombok.RequiredArgsConstructor;
import org.relaychat.events.chat.ChatEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Choisit les sessions destinataires d'un événement selon la politique de son canal,
 * puis pousse à chacune. Une session en erreur est ignorée, les autres reçoivent quand même.
 */
@Component
@RequiredArgsConstructor
public class FanoutRouter {

    private static final Logger log = LoggerFactory.getLogger(FanoutRouter.class);

    private final SessionRegistry registry;
    private final SessionPusher pusher;

    /** @return nombre de sessions effectivement atteintes */
    public int route(ChatEvent event) {
        Set<String> targets = targets(event);
        String name = event.channel().pushEvent();
        Object data = event.payload();
        int delivered = 0;
        for (String sessionId : targets) {
            try {
                pusher.push(sessionId, name, data);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Envoi {} à la session {} échoué: {}", name, sessionId, e.getMessage());
            }
        }
        log.debug("{} routé vers {}/{} sessions", name, delivered, targets.size());
        return delivered;
    }

    Set<String> targets(ChatEvent event) {
        return switch (event.channel().policy()) {
            case ROOM_ALL -> registry.sessionsInRoom(event.roomId());
            case ROOM_EXCLUDING_ACTOR -> {
                Set<String> room = new HashSet<>(registry.sessionsInRoom(event.roomId()));
                room.removeAll(registry.sessionsOfUser(event.actorId()));
                yield room;
            }
            case UNICAST_TARGET -> registry.sessionsOfUser(event.targetUserId());
            case GLOBAL -> registry.allSessions();
        };
    }
}
