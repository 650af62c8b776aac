package org.relaychat.dto;

import org.relaychat.model.Message;
import org.relaychat.model.MessageStatus;

import java.time.Instant;

public record MessageView(
        Long id,
        Long conversationId,
        Long senderId,
        String content,
        String messageType,
        Long replyTo,
        MessageStatus status,
        Instant createdAt,
        Instant editedAt
) {
    public static MessageView of(Message m) {
        return new MessageView(m.getId(), m.getConversationId(), m.getSenderId(), m.getContent(),
                m.getMessageType(), m.getReplyTo(), m.getStatus(), m.getCreatedAt(), m.getEditedAt());
    }
}
