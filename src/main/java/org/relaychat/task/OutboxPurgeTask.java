package org.relaychat.task;

import org.relaychat.service.identity.OutboxService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConditionalOnProperty(name = "app.outbox.relay-enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPurgeTask {

    private final OutboxService outboxService;
    private final Duration retention;

    public OutboxPurgeTask(OutboxService outboxService,
                           @Value("${app.outbox.retention-hours:168}") long retentionHours) {
        this.outboxService = outboxService;
        this.retention = Duration.ofHours(retentionHours);
    }

    // Cron : chaque heure, minute 15
    @Scheduled(cron = "${app.outbox.purge-cron:0 15 * * * *}")
    public void purge() {
        outboxService.purgeProcessedOlderThan(retention);
    }
}
