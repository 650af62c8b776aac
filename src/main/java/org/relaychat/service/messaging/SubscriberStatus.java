package org.relaychat.service.messaging;

import java.util.List;

public record SubscriberStatus(List<String> channels, long applied, long skipped, long failed, long malformed) {
}
