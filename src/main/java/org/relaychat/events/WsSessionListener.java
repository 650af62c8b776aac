package org.relaychat.events;

import lombok.RequiredArgsConstructor;
import org.relaychat.service.realtime.RealtimeGateway;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;

@Component
@RequiredArgsConstructor
public class WsSessionListener {

    private final RealtimeGateway gateway;

    @EventListener
    public void onConnect(SessionConnectEvent e) {
        StompHeaderAccessor acc = StompHeaderAccessor.wrap(e.getMessage());
        Principal p = acc.getUser();
        if (p != null && acc.getSessionId() != null) {
            gateway.onConnect(acc.getSessionId(), Long.valueOf(p.getName()));
        }
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent e) {
        gateway.onDisconnect(e.getSessionId());
    }
}
