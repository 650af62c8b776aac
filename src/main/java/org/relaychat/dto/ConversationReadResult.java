package org.relaychat.dto;

import java.util.List;

public record ConversationReadResult(Long conversationId, Long userId, Long lastReadMessageId,
                                     List<Long> newlyReadMessageIds) {
}
