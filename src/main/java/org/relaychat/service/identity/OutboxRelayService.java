package org.relaychat.service.identity;

import org.relaychat.broker.EventPublisher;
import org.relaychat.model.UserEventOutbox;
import org.relaychat.repo.UserEventOutboxRepository;
import org.relaychat.service.support.ExponentialBackoffRetryPolicy;
import org.relaychat.service.support.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Relais de l'outbox vers le broker : publie les lignes en attente dans l'ordre de création
 * puis les marque traitées. Livraison au moins une fois ; l'état de reprise tient
 * entièrement dans la colonne {@code processed}.
 */
@Service
public class OutboxRelayService {

    private static final Logger log = LoggerFactory.getLogger(OutboxRelayService.class);

    private final UserEventOutboxRepository outboxRepo;
    private final EventPublisher publisher;
    private final RetryPolicy retryPolicy;
    private final int batchSize;
    private final int maxAttempts;
    private final int deadAfterCycles;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Autowired
    public OutboxRelayService(UserEventOutboxRepository outboxRepo,
                              EventPublisher publisher,
                              @Value("${app.outbox.batch-size:50}") int batchSize,
                              @Value("${app.outbox.max-attempts:5}") int maxAttempts,
                              @Value("${app.outbox.retry-base-ms:2000}") long retryBaseMs,
                              @Value("${app.outbox.retry-max-delay-ms:16000}") long retryMaxDelayMs,
                              @Value("${app.outbox.dead-after-cycles:20}") int deadAfterCycles) {
        this(outboxRepo, publisher, new ExponentialBackoffRetryPolicy(retryBaseMs, retryMaxDelayMs),
                batchSize, maxAttempts, deadAfterCycles);
    }

    public OutboxRelayService(UserEventOutboxRepository outboxRepo,
                              EventPublisher publisher,
                              RetryPolicy retryPolicy,
                              int batchSize,
                              int maxAttempts,
                              int deadAfterCycles) {
        if (batchSize <= 0) throw new IllegalArgumentException("batchSize doit être > 0");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts doit être > 0");
        this.outboxRepo = outboxRepo;
        this.publisher = publisher;
        this.retryPolicy = retryPolicy;
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
        this.deadAfterCycles = deadAfterCycles;
    }

    /**
     * Un passage complet : lot suivant, publication, marquage.
     * Sans effet si un passage est déjà en cours dans ce processus.
     */
    public RelayCycle processNow() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Relais déjà en cours, passage ignoré");
            return RelayCycle.alreadyRunning();
        }
        try {
            List<UserEventOutbox> rows = outboxRepo.findPending(PageRequest.of(0, batchSize));
            int published = 0, failed = 0, dead = 0;
            for (UserEventOutbox row : rows) {
                if (Thread.currentThread().isInterrupted()) break;
                switch (relay(row)) {
                    case PUBLISHED -> published++;
                    case FAILED -> failed++;
                    case DEAD -> { failed++; dead++; }
                }
            }
            if (!rows.isEmpty()) {
                log.info("Relais: {} lignes, {} publiées, {} en échec", rows.size(), published, failed);
            }
            return new RelayCycle(rows.size(), published, failed, dead, false);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private enum RowOutcome { PUBLISHED, FAILED, DEAD }

    private RowOutcome relay(UserEventOutbox row) {
        String channel = row.getEventType().channel();
        RuntimeException lastError = null;
        boolean sent = false;

        for (int attempt = 1; attempt <= maxAttempts && !sent; attempt++) {
            try {
                publisher.publish(channel, row.getPayload());
                sent = true;
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Publication de la ligne {} échouée (tentative {}/{}): {}",
                        row.getId(), attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts && !pause(retryPolicy.computeDelayMs(attempt))) {
                    break;
                }
            }
        }

        if (sent) {
            // publiée : si le marquage échoue, la ligne sera republiée au passage suivant
            try {
                if (outboxRepo.markProcessed(row.getId(), Instant.now()) == 0) {
                    log.debug("Ligne {} déjà marquée traitée", row.getId());
                }
            } catch (RuntimeException e) {
                log.warn("Ligne {} publiée mais non marquée: {}", row.getId(), e.getMessage());
            }
            return RowOutcome.PUBLISHED;
        }

        return recordFailedCycle(row, lastError);
    }

    private RowOutcome recordFailedCycle(UserEventOutbox row, RuntimeException error) {
        String message = error == null ? "interrompu" : truncate(String.valueOf(error.getMessage()));
        try {
            outboxRepo.recordFailure(row.getId(), message);
            int cycles = row.getAttempts() + 1;
            if (deadAfterCycles > 0 && cycles >= deadAfterCycles) {
                outboxRepo.markDead(row.getId(), Instant.now());
                log.error("Ligne {} ({} sujet {}) abandonnée après {} passages en échec: {}",
                        row.getId(), row.getEventType(), row.getSubjectId(), cycles, message);
                return RowOutcome.DEAD;
            }
        } catch (RuntimeException e) {
            log.warn("Impossible d'enregistrer l'échec de la ligne {}: {}", row.getId(), e.getMessage());
        }
        return RowOutcome.FAILED;
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

    private static String truncate(String s) {
        return s.length() <= 500 ? s : s.substring(0, 500);
    }
}
