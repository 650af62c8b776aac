package org.relaychat.security;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Refuse l'ouverture du WebSocket sans JWT valide (401).
 * SockJS ne transmet pas d'en-têtes : le jeton arrive le plus souvent en {@code ?token=}.
 * Le jeton et l'identifiant restent dans les attributs de session pour le CONNECT STOMP.
 */
@Component
@RequiredArgsConstructor
public class JwtHandshakeInterceptor implements HandshakeInterceptor {

    public static final String TOKEN_ATTR = "token";
    public static final String USER_ID_ATTR = "userId";

    private static final Logger log = LoggerFactory.getLogger(JwtHandshakeInterceptor.class);

    private final JwtUtil jwtUtil;

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        String token = tokenOf(request);
        if (token == null || !jwtUtil.validateToken(token)) {
            log.debug("Ouverture WebSocket refusée depuis {}", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(TOKEN_ATTR, token);
        attributes.put(USER_ID_ATTR, jwtUtil.extractUserId(token));
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               @Nullable Exception ex) {
        if (ex != null) {
            log.warn("Échec de l'ouverture WebSocket: {}", ex.getMessage());
        }
    }

    // paramètre de requête d'abord, puis Authorization: Bearer
    static String tokenOf(ServerHttpRequest request) {
        String fromQuery = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("token");
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        String auth = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (auth != null && auth.startsWith("Bearer ") && auth.length() > 7) {
            return auth.substring(7);
        }
        return null;
    }
}
