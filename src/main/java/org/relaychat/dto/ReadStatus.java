package org.relaychat.dto;

import java.time.Instant;

public record ReadStatus(Long lastReadMessageId, Instant lastReadAt, long unreadCount) {
}
