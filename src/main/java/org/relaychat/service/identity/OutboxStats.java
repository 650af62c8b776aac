package org.relaychat.service.identity;

public record OutboxStats(long total, long processed, long pending, long dead) {
}
