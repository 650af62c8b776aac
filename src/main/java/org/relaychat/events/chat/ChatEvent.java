package org.relaychat.events.chat;

import org.relaychat.dto.MessageView;

import java.time.Instant;
import java.util.List;

/**
 * Événements de messagerie publiés sur le broker après commit, puis routés par la passerelle.
 */
public sealed interface ChatEvent {

    ChatChannel channel();

    /** salle concernée, null pour un événement global */
    default Long roomId() {
        return null;
    }

    /** utilisateur à l'origine de l'événement */
    default Long actorId() {
        return null;
    }

    /** destinataire d'un envoi ciblé */
    default Long targetUserId() {
        return null;
    }

    /** données poussées au client */
    default Object payload() {
        return this;
    }

    record NewMessage(MessageView message) implements ChatEvent {
        public ChatChannel channel() { return ChatChannel.NEW_MESSAGE; }
        public Long roomId() { return message.conversationId(); }
        public Long actorId() { return message.senderId(); }
        public Object payload() { return message; }
    }

    record MessageUpdated(MessageView message) implements ChatEvent {
        public ChatChannel channel() { return ChatChannel.MESSAGE_UPDATED; }
        public Long roomId() { return message.conversationId(); }
        public Long actorId() { return message.senderId(); }
        public Object payload() { return message; }
    }

    record MessageDeleted(Long messageId, Long conversationId, Long deletedBy) implements ChatEvent {
        public ChatChannel channel() { return ChatChannel.MESSAGE_DELETED; }
        public Long roomId() { return conversationId; }
        public Long actorId() { return deletedBy; }
    }

    record MessageDelivered(Long messageId, Long conversationId, Long userId, Instant timestamp) implements ChatEvent {
        public ChatChannel channel() { return ChatChannel.MESSAGE_DELIVERED; }
        public Long roomId() { return conversationId; }
        public Long actorId() { return userId; }
    }

    record MessageRead(Long messageId, Long conversationId, Long userId, Instant timestamp) implements ChatEvent {
        public ChatChannel channel() { return ChatChannel.MESSAGE_READ; }
        public Long roomId() { return conversationId; }
        public Long actorId() { return userId; }
    }

    record ConversationRead(Long conversationId, Long userId, List<Long> messageIds, Long lastReadMessageId,
                            Instant timestamp) implements ChatEvent {
        public ChatChannel channel() { return ChatChannel.CONVERSATION_READ; }
        public Long roomId() { return conversationId; }
        public Long actorId() { return userId; }
    }

    record ConversationCreated(Long conversationId, Long invitedUserId, Long createdBy, String kind, String name)
            implements ChatEvent {
        public ChatChannel channel() { return ChatChannel.CONVERSATION_CREATED; }
        public Long actorId() { return createdBy; }
        public Long targetUserId() { return invitedUserId; }
    }

    record TypingIndicator(Long conversationId, Long userId, boolean typing, Instant timestamp) implements ChatEvent {
        public ChatChannel channel() { return ChatChannel.TYPING_INDICATOR; }
        public Long roomId() { return conversationId; }
        public Long actorId() { return userId; }
    }

    record UserPresence(Long userId, String status, Instant lastSeen) implements ChatEvent {
        public ChatChannel channel() { return ChatChannel.USER_PRESENCE; }
        public Long actorId() { return userId; }
    }
}
