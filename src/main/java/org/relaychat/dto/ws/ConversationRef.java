package org.relaychat.dto.ws;

import lombok.Data;

/** Corps des messages STOMP clients : {@code {"conversationId": 12}}. */
@Data
public class ConversationRef {
    private Long conversationId;
}
