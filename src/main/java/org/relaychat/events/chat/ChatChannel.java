package org.relaychat.events.chat;

import java.util.Arrays;
import java.util.Optional;

/**
 * Canaux Redis des événements de messagerie, avec leur politique de routage
 * et le nom de l'événement poussé au client.
 */
public enum ChatChannel {
    NEW_MESSAGE("new_message", RoutingPolicy.ROOM_ALL, "new_message", ChatEvent.NewMessage.class),
    MESSAGE_UPDATED("message_updated", RoutingPolicy.ROOM_ALL, "message_updated", ChatEvent.MessageUpdated.class),
    MESSAGE_DELETED("message_deleted", RoutingPolicy.ROOM_ALL, "message_deleted", ChatEvent.MessageDeleted.class),
    MESSAGE_DELIVERED("message_delivered", RoutingPolicy.ROOM_EXCLUDING_ACTOR, "message_delivered", ChatEvent.MessageDelivered.class),
    MESSAGE_READ("message_read", RoutingPolicy.ROOM_EXCLUDING_ACTOR, "message_read", ChatEvent.MessageRead.class),
    CONVERSATION_READ("conversation_read", RoutingPolicy.ROOM_EXCLUDING_ACTOR, "conversation_read", ChatEvent.ConversationRead.class),
    CONVERSATION_CREATED("conversation_created", RoutingPolicy.UNICAST_TARGET, "conversation_created", ChatEvent.ConversationCreated.class),
    TYPING_INDICATOR("typing_indicator", RoutingPolicy.ROOM_EXCLUDING_ACTOR, "typing_indicator", ChatEvent.TypingIndicator.class),
    USER_PRESENCE("user_presence", RoutingPolicy.GLOBAL, "user_presence_update", ChatEvent.UserPresence.class);

    private final String channel;
    private final RoutingPolicy policy;
    private final String pushEvent;
    private final Class<? extends ChatEvent> payloadType;

    ChatChannel(String channel, RoutingPolicy policy, String pushEvent, Class<? extends ChatEvent> payloadType) {
        this.channel = channel;
        this.policy = policy;
        this.pushEvent = pushEvent;
        this.payloadType = payloadType;
    }

    public String channel() {
        return channel;
    }

    public RoutingPolicy policy() {
        return policy;
    }

    public String pushEvent() {
        return pushEvent;
    }

    public Class<? extends ChatEvent> payloadType() {
        return payloadType;
    }

    public static Optional<ChatChannel> fromChannel(String name) {
        return Arrays.stream(values()).filter(c -> c.channel.equals(name)).findFirst();
    }
}
