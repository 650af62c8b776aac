package org.relaychat.controller;

import lombok.RequiredArgsConstructor;
import org.relaychat.dto.ws.ConversationRef;
import org.relaychat.service.realtime.RealtimeGateway;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * Messages STOMP clients, envoyés sur {@code /app/<type>}.
 */
@Controller
@RequiredArgsConstructor
public class ChatWsController {

    private final RealtimeGateway gateway;

    @MessageMapping("/join_conversation")
    public void join(@Payload ConversationRef ref, Principal principal, @Header("simpSessionId") String sessionId) {
        gateway.joinConversation(sessionId, userId(principal), ref.getConversationId());
    }

    @MessageMapping("/leave_conversation")
    public void leave(@Payload ConversationRef ref, Principal principal, @Header("simpSessionId") String sessionId) {
        gateway.leaveConversation(sessionId, userId(principal), ref.getConversationId());
    }

    @MessageMapping("/typing_start")
    public void typingStart(@Payload ConversationRef ref, Principal principal, @Header("simpSessionId") String sessionId) {
        gateway.typingStart(sessionId, userId(principal), ref.getConversationId());
    }

    @MessageMapping("/typing_stop")
    public void typingStop(@Payload ConversationRef ref, Principal principal, @Header("simpSessionId") String sessionId) {
        gateway.typingStop(sessionId, userId(principal), ref.getConversationId());
    }

    @MessageMapping("/mark_read")
    public void markRead(@Payload ConversationRef ref, Principal principal, @Header("simpSessionId") String sessionId) {
        gateway.markRead(sessionId, userId(principal), ref.getConversationId());
    }

    private static Long userId(Principal principal) {
        if (principal == null) throw new IllegalStateException("Session non authentifiée");
        return Long.valueOf(principal.getName());
    }
}
