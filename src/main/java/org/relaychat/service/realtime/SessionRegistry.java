package org.relaychat.service.realtime;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sessions WebSocket de ce processus, indexées par session, par utilisateur et par salle.
 * Une session est dans au plus une salle (la conversation ouverte côté client).
 */
@Component
public class SessionRegistry {

    /** Session supprimée du registre. */
    public record Removed(String sessionId, Long userId, Long roomId, boolean lastSessionOfUser) {}

    private static final class SessionInfo {
        final String sessionId;
        final Long userId;
        volatile Long roomId;

        SessionInfo(String sessionId, Long userId) {
            this.sessionId = sessionId;
            this.userId = userId;
        }
    }

    private final Map<String, SessionInfo> sessions = new ConcurrentHashMap<>();
    private final Map<Long, Set<String>> byUser = new ConcurrentHashMap<>();
    private final Map<Long, Set<String>> byRoom = new ConcurrentHashMap<>();

    /** @return vrai si c'est la première session de cet utilisateur */
    public boolean register(String sessionId, Long userId) {
        if (sessions.putIfAbsent(sessionId, new SessionInfo(sessionId, userId)) != null) {
            return false;
        }
        AtomicBoolean first = new AtomicBoolean(false);
        byUser.compute(userId, (k, set) -> {
            if (set == null) {
                set = ConcurrentHashMap.newKeySet();
                first.set(true);
            }
            set.add(sessionId);
            return set;
        });
        return first.get();
    }

    public Optional<Removed> unregister(String sessionId) {
        SessionInfo info = sessions.remove(sessionId);
        if (info == null) return Optional.empty();
        Long room = info.roomId;
        if (room != null) removeFrom(byRoom, room, sessionId);
        boolean last = removeFrom(byUser, info.userId, sessionId);
        return Optional.of(new Removed(sessionId, info.userId, room, last));
    }

    /**
     * Place la session dans une salle, en quittant la précédente.
     *
     * @return la salle quittée, vide si aucune ou si c'était la même
     */
    public Optional<Long> joinRoom(String sessionId, Long roomId) {
        SessionInfo info = sessions.get(sessionId);
        if (info == null) {
            throw new IllegalStateException("Session inconnue: " + sessionId);
        }
        synchronized (info) {
            Long previous = info.roomId;
            if (roomId.equals(previous)) return Optional.empty();
            if (previous != null) removeFrom(byRoom, previous, sessionId);
            byRoom.computeIfAbsent(roomId, k -> ConcurrentHashMap.newKeySet()).add(sessionId);
            info.roomId = roomId;
            return Optional.ofNullable(previous);
        }
    }

    /** @return vrai si la session était bien dans cette salle */
    public boolean leaveRoom(String sessionId, Long roomId) {
        SessionInfo info = sessions.get(sessionId);
        if (info == null) return false;
        synchronized (info) {
            if (!roomId.equals(info.roomId)) return false;
            info.roomId = null;
            removeFrom(byRoom, roomId, sessionId);
            return true;
        }
    }

    public Optional<Long> currentRoom(String sessionId) {
        SessionInfo info = sessions.get(sessionId);
        return info == null ? Optional.empty() : Optional.ofNullable(info.roomId);
    }

    public Optional<Long> userOf(String sessionId) {
        SessionInfo info = sessions.get(sessionId);
        return info == null ? Optional.empty() : Optional.of(info.userId);
    }

    public Set<String> sessionsOfUser(Long userId) {
        Set<String> set = userId == null ? null : byUser.get(userId);
        return set == null ? Set.of() : Set.copyOf(set);
    }

    public Set<String> sessionsInRoom(Long roomId) {
        Set<String> set = roomId == null ? null : byRoom.get(roomId);
        return set == null ? Set.of() : Set.copyOf(set);
    }

    public Set<String> allSessions() {
        return Set.copyOf(sessions.keySet());
    }

    public int sessionCount() {
        return sessions.size();
    }

    public int userCount() {
        return byUser.size();
    }

    public Map<Long, Integer> roomSizes() {
        Map<Long, Integer> out = new ConcurrentHashMap<>();
        byRoom.forEach((room, set) -> out.put(room, set.size()));
        return out;
    }

    // retire la session de l'index ; supprime l'entrée devenue vide. Renvoie vrai si elle l'est devenue.
    private static boolean removeFrom(Map<Long, Set<String>> index, Long key, String sessionId) {
        AtomicBoolean emptied = new AtomicBoolean(false);
        index.computeIfPresent(key, (k, set) -> {
            set.remove(sessionId);
            if (set.isEmpty()) {
                emptied.set(true);
                return null;
            }
            return set;
        });
        return emptied.get();
    }
}
