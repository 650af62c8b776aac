package org.relaychat.service.realtime;

import java.time.Instant;

public record Presence(Long userId, String status, String socketId, Instant lastSeen) {

    public static final String ONLINE = "online";
    public static final String OFFLINE = "offline";

    public boolean online() {
        return ONLINE.equals(status);
    }
}
