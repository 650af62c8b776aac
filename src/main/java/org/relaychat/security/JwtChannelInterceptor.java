package org.relaychat.security;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Authentifie la connexion STOMP via JWT.
 * Un CONNECT sans jeton valide lève une exception, ce qui ferme la session.
 */
@Component
@RequiredArgsConstructor
public class JwtChannelInterceptor implements ChannelInterceptor {

    private static final Logger log = LoggerFactory.getLogger(JwtChannelInterceptor.class);

    private final JwtUtil jwtUtil;
    private final UserDetailsService userDetailsService;

    @Override
    public Message<?> preSend(Message<?> message, MessageChannel channel) {
        StompHeaderAccessor acc = StompHeaderAccessor.wrap(message);
        acc.setLeaveMutable(true);

        if (StompCommand.CONNECT.equals(acc.getCommand())) {
            String token = extractToken(acc);
            if (token == null || !jwtUtil.validateToken(token)) {
                throw new IllegalArgumentException("Invalid or missing JWT token");
            }
            UserDetails ud = userDetailsService.loadUserByUsername(String.valueOf(jwtUtil.extractUserId(token)));
            Authentication auth = new UsernamePasswordAuthenticationToken(ud, null, ud.getAuthorities());
            acc.setUser(auth);
            SecurityContextHolder.getContext().setAuthentication(auth);
            log.debug("CONNECT STOMP session {} -> utilisateur {}", acc.getSessionId(), ud.getUsername());
        } else {
            var user = acc.getUser();
            if (user instanceof Authentication a) {
                SecurityContextHolder.getContext().setAuthentication(a);
            } else {
                SecurityContextHolder.clearContext();
            }
        }
        return MessageBuilder.createMessage(message.getPayload(), acc.getMessageHeaders());
    }

    private String extractToken(StompHeaderAccessor acc) {
        List<String> auths = acc.getNativeHeader("Authorization");
        if (auths != null && !auths.isEmpty()) {
            String v = auths.get(0);
            if (v != null && v.startsWith("Bearer ")) return v.substring(7);
        }
        List<String> toks = acc.getNativeHeader("token");
        if (toks != null && !toks.isEmpty()) return toks.get(0);

        var attrs = acc.getSessionAttributes();
        if (attrs != null) {
            Object sessTok = attrs.get(JwtHandshakeInterceptor.TOKEN_ATTR);
            if (sessTok instanceof String s && !s.isBlank()) return s;
        }
        return null;
    }
}
