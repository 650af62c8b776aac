package org.relaychat.service.realtime;

/**
 * Envoi d'un événement à une session WebSocket précise.
 */
public interface SessionPusher {
    void push(String sessionId, String event, Object data);
}
