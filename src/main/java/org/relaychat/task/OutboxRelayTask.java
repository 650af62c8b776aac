package org.relaychat.task;

import lombok.RequiredArgsConstructor;
import org.relaychat.service.identity.OutboxRelayService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.outbox.relay-enabled", havingValue = "true", matchIfMissing = true)
public class OutboxRelayTask {

    private final OutboxRelayService relay;

    // délai fixe : un passage ne démarre qu'une fois le précédent terminé
    @Scheduled(fixedDelayString = "${app.outbox.relay-interval-ms:1000}", initialDelayString = "${app.outbox.relay-initial-delay-ms:2000}")
    public void relayPending() {
        relay.processNow();
    }
}
