package org.relaychat.service.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.relaychat.events.user.UserEvent;
import org.relaychat.model.UserEventType;
import org.relaychat.service.support.ExponentialBackoffRetryPolicy;
import org.relaychat.service.support.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Abonné au canal {@code user_events} : décode chaque événement et l'applique à la réplique.
 * Les erreurs transitoires sont retentées avec backoff ; au-delà, l'événement est journalisé
 * et abandonné (un instantané plus récent réparera la réplique).
 */
@Component
@ConditionalOnProperty(name = "app.subscriber.enabled", havingValue = "true", matchIfMissing = true)
public class UserEventSubscriber implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(UserEventSubscriber.class);

    private final UserProfileReplicaService replica;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final int maxAttempts;

    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong malformed = new AtomicLong();

    @Autowired
    public UserEventSubscriber(UserProfileReplicaService replica,
                               ObjectMapper objectMapper,
                               @Value("${app.subscriber.max-attempts:3}") int maxAttempts,
                               @Value("${app.subscriber.retry-base-ms:200}") long retryBaseMs) {
        this(replica, objectMapper, new ExponentialBackoffRetryPolicy(retryBaseMs, retryBaseMs * 8), maxAttempts);
    }

    public UserEventSubscriber(UserProfileReplicaService replica, ObjectMapper objectMapper,
                               RetryPolicy retryPolicy, int maxAttempts) {
        this.replica = replica;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        UserEvent event;
        try {
            event = objectMapper.readValue(message.getBody(), UserEvent.class);
        } catch (IOException e) {
            malformed.incrementAndGet();
            log.warn("Événement utilisateur illisible, abandonné: {}", e.getMessage());
            return;
        }
        onEvent(event);
    }

    public ApplyOutcome onEvent(UserEvent event) {
        for (int attempt = 1; ; attempt++) {
            try {
                ApplyOutcome outcome = replica.apply(event);
                (outcome == ApplyOutcome.APPLIED ? applied : skipped).incrementAndGet();
                return outcome;
            } catch (IllegalArgumentException e) {
                malformed.incrementAndGet();
                log.warn("Événement {} invalide, abandonné: {}", event.eventId(), e.getMessage());
                return null;
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts) {
                    failed.incrementAndGet();
                    log.error("Événement {} ({} utilisateur {}) non appliqué après {} tentatives",
                            event.eventId(), event.type(), event.userId(), attempt, e);
                    return null;
                }
                log.warn("Application de {} échouée (tentative {}/{}): {}",
                        event.eventId(), attempt, maxAttempts, e.getMessage());
                if (!pause(retryPolicy.computeDelayMs(attempt))) {
                    failed.incrementAndGet();
                    return null;
                }
            }
        }
    }

    public SubscriberStatus status() {
        return new SubscriberStatus(List.of(UserEventType.USER_EVENTS_CHANNEL),
                applied.get(), skipped.get(), failed.get(), malformed.get());
    }

    private static boolean pause(long delayMs) {
        if (delayMs <= 0) return true;
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
