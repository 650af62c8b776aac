package org.relaychat.service.realtime;

import org.relaychat.events.chat.ChatEvent;
import org.relaychat.kv.KvClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Présence et indicateurs de saisie, entièrement dans Redis.
 * Un indicateur de saisie est une clé à durée de vie : elle existe, l'utilisateur écrit ;
 * elle a expiré ou n'existe pas, il n'écrit plus. Les erreurs Redis ne remontent jamais.
 */
@Service
public class PresenceService {

    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    static final String ONLINE_USERS = "online_users";
    private static final int TYPING_SCAN_LIMIT = 500;

    private final KvClient kv;
    private final ApplicationEventPublisher events;
    private final Duration typingTtl;
    private final Clock clock;

    @Autowired
    public PresenceService(KvClient kv,
                           ApplicationEventPublisher events,
                           @Value("${app.presence.typing-ttl-seconds:10}") long typingTtlSeconds) {
        this(kv, events, Duration.ofSeconds(typingTtlSeconds), Clock.systemUTC());
    }

    PresenceService(KvClient kv, ApplicationEventPublisher events, Duration typingTtl, Clock clock) {
        this.kv = kv;
        this.events = events;
        this.typingTtl = typingTtl;
        this.clock = clock;
    }

    public static String presenceKey(Long userId) {
        return "user:" + userId + ":presence";
    }

    public static String typingKey(Long conversationId, Long userId) {
        return typingPrefix(conversationId) + userId;
    }

    private static String typingPrefix(Long conversationId) {
        return "typing:" + conversationId + ":";
    }

    public void setOnline(Long userId, String socketId) {
        Instant now = clock.instant();
        try {
            kv.hset(presenceKey(userId), Map.of(
                    "status", Presence.ONLINE,
                    "socketId", socketId == null ? "" : socketId,
                    "lastSeen", now.toString()));
            kv.sadd(ONLINE_USERS, String.valueOf(userId));
        } catch (RuntimeException e) {
            log.warn("Présence en ligne de {} non enregistrée: {}", userId, e.getMessage());
        }
        events.publishEvent(new ChatEvent.UserPresence(userId, Presence.ONLINE, now));
    }

    public void setOffline(Long userId) {
        Instant now = clock.instant();
        try {
            kv.hset(presenceKey(userId), Map.of(
                    "status", Presence.OFFLINE,
                    "socketId", "",
                    "lastSeen", now.toString()));
            kv.srem(ONLINE_USERS, String.valueOf(userId));
        } catch (RuntimeException e) {
            log.warn("Présence hors ligne de {} non enregistrée: {}", userId, e.getMessage());
        }
        events.publishEvent(new ChatEvent.UserPresence(userId, Presence.OFFLINE, now));
    }

    public Presence getPresence(Long userId) {
        try {
            Map<String, String> h = kv.hgetAll(presenceKey(userId));
            if (h.isEmpty()) {
                return new Presence(userId, Presence.OFFLINE, null, null);
            }
            String socketId = h.get("socketId");
            return new Presence(userId,
                    h.getOrDefault("status", Presence.OFFLINE),
                    socketId == null || socketId.isEmpty() ? null : socketId,
                    parseInstant(h.get("lastSeen")));
        } catch (RuntimeException e) {
            log.warn("Présence de {} illisible: {}", userId, e.getMessage());
            return new Presence(userId, Presence.OFFLINE, null, null);
        }
    }

    public Set<Long> onlineUsers() {
        try {
            return toIds(kv.smembers(ONLINE_USERS));
        } catch (RuntimeException e) {
            log.warn("Liste des utilisateurs en ligne illisible: {}", e.getMessage());
            return Set.of();
        }
    }

    /** Pose (ou rafraîchit) l'indicateur de saisie. */
    public void setTyping(Long userId, Long conversationId) {
        try {
            kv.set(typingKey(conversationId, userId), "1", typingTtl);
        } catch (RuntimeException e) {
            log.warn("Indicateur de saisie de {} dans {} non posé: {}", userId, conversationId, e.getMessage());
        }
        events.publishEvent(new ChatEvent.TypingIndicator(conversationId, userId, true, clock.instant()));
    }

    /**
     * Signale la fin de saisie aux autres participants. La clé n'est pas supprimée :
     * elle expire d'elle-même, ce qui couvre aussi un client qui disparaît sans prévenir.
     */
    public void stopTyping(Long userId, Long conversationId) {
        events.publishEvent(new ChatEvent.TypingIndicator(conversationId, userId, false, clock.instant()));
    }

    public boolean isTyping(Long userId, Long conversationId) {
        try {
            return kv.exists(typingKey(conversationId, userId));
        } catch (RuntimeException e) {
            log.warn("Indicateur de saisie illisible: {}", e.getMessage());
            return false;
        }
    }

    public Set<Long> typingUsers(Long conversationId) {
        String prefix = typingPrefix(conversationId);
        try {
            Set<Long> ids = new TreeSet<>();
            for (String key : kv.scan(prefix, TYPING_SCAN_LIMIT)) {
                try {
                    ids.add(Long.valueOf(key.substring(prefix.length())));
                } catch (NumberFormatException e) {
                    log.debug("Clé de saisie hors format ignorée: {}", key);
                }
            }
            return ids;
        } catch (RuntimeException e) {
            log.warn("Saisies en cours dans {} illisibles: {}", conversationId, e.getMessage());
            return Set.of();
        }
    }

    private static Set<Long> toIds(Set<String> raw) {
        Set<Long> ids = new TreeSet<>();
        for (String s : raw) {
            try {
                ids.add(Long.valueOf(s));
            } catch (NumberFormatException e) {
                log.debug("Membre inattendu dans {}: {}", ONLINE_USERS, s);
            }
        }
        return ids;
    }

    private static Instant parseInstant(String s) {
        if (s == null || s.isEmpty()) return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
