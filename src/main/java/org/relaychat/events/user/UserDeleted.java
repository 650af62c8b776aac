package org.relaychat.events.user;

import org.relaychat.model.UserEventType;

import java.time.Instant;

public record UserDeleted(String eventId, Long userId, Instant timestamp, long version, UserSnapshot data)
        implements UserEvent {

    @Override
    public UserEventType type() {
        return UserEventType.USER_DELETED;
    }
}
