package org.relaychat.controller;

import lombok.RequiredArgsConstructor;
import org.relaychat.model.UserEventOutbox;
import org.relaychat.service.identity.OutboxRelayService;
import org.relaychat.service.identity.OutboxService;
import org.relaychat.service.identity.OutboxStats;
import org.relaychat.service.identity.RelayCycle;
import org.relaychat.service.messaging.UserEventSubscriber;
import org.relaychat.service.realtime.RealtimeGateway;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Supervision : outbox, abonné identité, passerelle.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final OutboxService outboxService;
    private final OutboxRelayService relayService;
    private final ObjectProvider<UserEventSubscriber> subscriber;
    private final RealtimeGateway gateway;

    @GetMapping("/outbox/stats")
    public OutboxStats outboxStats() {
        return outboxService.stats();
    }

    @GetMapping("/outbox/dead")
    public List<UserEventOutbox> deadLetters(@RequestParam(value = "limit", defaultValue = "50") int limit) {
        return outboxService.deadLetters(limit);
    }

    @PostMapping("/outbox/dead/{id}/replay")
    public ResponseEntity<?> replay(@PathVariable Long id) {
        outboxService.replay(id);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @PostMapping("/outbox/relay")
    public RelayCycle relayNow() {
        return relayService.processNow();
    }

    @GetMapping("/subscriber/status")
    public ResponseEntity<?> subscriberStatus() {
        UserEventSubscriber s = subscriber.getIfAvailable();
        if (s == null) {
            return ResponseEntity.ok(Map.of("enabled", false));
        }
        return ResponseEntity.ok(s.status());
    }

    @GetMapping("/realtime/status")
    public Object realtimeStatus() {
        return gateway.status();
    }
}
