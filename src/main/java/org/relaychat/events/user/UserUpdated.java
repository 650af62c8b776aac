package org.relaychat.events.user;

import org.relaychat.model.UserEventType;

import java.time.Instant;
import java.util.List;

public record UserUpdated(String eventId, Long userId, Instant timestamp, long version, UserSnapshot data,
                          List<String> changes) implements UserEvent {

    public UserUpdated {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    @Override
    public UserEventType type() {
        return UserEventType.USER_UPDATED;
    }
}
