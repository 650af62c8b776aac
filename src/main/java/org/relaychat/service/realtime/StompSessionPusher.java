package org.relaychat.service.realtime;

import lombok.RequiredArgsConstructor;
import org.relaychat.dto.ws.WsEnvelope;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pousse vers {@code /user/queue/events} d'une seule session : la destination utilisateur
 * porte l'id de session, que Spring résout vers cette session uniquement.
 */
@Component
@RequiredArgsConstructor
public class StompSessionPusher implements SessionPusher {

    public static final String EVENTS_QUEUE = "/queue/events";

    private final SimpMessagingTemplate messaging;

    @Override
    public void push(String sessionId, String event, Object data) {
        messaging.convertAndSendToUser(sessionId, EVENTS_QUEUE, new WsEnvelope(event, data), headers(sessionId));
    }

    private static MessageHeaders headers(String sessionId) {
        SimpMessageHeaderAccessor acc = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        acc.setSessionId(sessionId);
        acc.setLeaveMutable(true);
        return acc.getMessageHeaders();
    }
}
