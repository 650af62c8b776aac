package org.relaychat.events.user;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.relaychat.model.UserEventType;

import java.time.Instant;

/**
 * Événement d'identité relayé par l'outbox. Le champ {@code eventType} du JSON porte la variante.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "eventType")
@JsonSubTypes({
        @JsonSubTypes.Type(value = UserCreated.class, name = "USER_CREATED"),
        @JsonSubTypes.Type(value = UserUpdated.class, name = "USER_UPDATED"),
        @JsonSubTypes.Type(value = UserDeleted.class, name = "USER_DELETED")
})
public sealed interface UserEvent permits UserCreated, UserUpdated, UserDeleted {

    String eventId();

    Long userId();

    Instant timestamp();

    /** Version de la ligne source ; la réplique ignore toute version inférieure à la sienne. */
    long version();

    UserSnapshot data();

    UserEventType type();
}
