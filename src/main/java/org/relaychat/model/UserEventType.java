package org.relaychat.model;

/**
 * Types d'événements d'identité. Chaque famille est publiée sur son propre canal Redis.
 */
public enum UserEventType {
    USER_CREATED,
    USER_UPDATED,
    USER_DELETED;

    public static final String USER_EVENTS_CHANNEL = "user_events";

    public String channel() {
        return USER_EVENTS_CHANNEL;
    }
}
