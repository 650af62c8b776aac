package org.relaychat.service.realtime;

import java.util.Map;

public record GatewayStatus(int sessions, int users, Map<Long, Integer> rooms) {
}
