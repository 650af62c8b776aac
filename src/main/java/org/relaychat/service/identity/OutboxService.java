package org.relaychat.service.identity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.relaychat.events.user.UserEvent;
import org.relaychat.exception.NotFoundException;
import org.relaychat.model.UserEventOutbox;
import org.relaychat.model.UserEventType;
import org.relaychat.repo.UserEventOutboxRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Écriture et administration de l'outbox des événements d'identité.
 */
@Service
@RequiredArgsConstructor
public class OutboxService {

    private static final Logger log = LoggerFactory.getLogger(OutboxService.class);

    private final UserEventOutboxRepository outboxRepo;
    private final ObjectMapper objectMapper;

    /**
     * Ajoute une ligne dans la transaction de l'appelant. Sans transaction en cours,
     * Spring lève une {@code IllegalTransactionStateException} : un événement n'existe
     * jamais sans la mutation qui l'a produit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public UserEventOutbox recordEvent(Long subjectId, UserEventType type, String payload) {
        UserEventOutbox row = UserEventOutbox.builder()
                .subjectId(subjectId)
                .eventType(type)
                .payload(payload)
                .processed(false)
                .build();
        UserEventOutbox saved = outboxRepo.save(row);
        log.debug("Outbox: {} pour l'utilisateur {} (ligne {})", type, subjectId, saved.getId());
        return saved;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public UserEventOutbox record(UserEvent event) {
        try {
            return recordEvent(event.userId(), event.type(), objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Événement " + event.type() + " non sérialisable", e);
        }
    }

    public OutboxStats stats() {
        long total = outboxRepo.count();
        long processed = outboxRepo.countByProcessed(true);
        long dead = outboxRepo.countByDeadAtIsNotNull();
        return new OutboxStats(total, processed, total - processed - dead, dead);
    }

    public List<UserEventOutbox> deadLetters(int limit) {
        return outboxRepo.findByDeadAtIsNotNullOrderByDeadAtDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    public void replay(Long id) {
        if (outboxRepo.replay(id) == 0) {
            throw new NotFoundException("Aucune ligne morte " + id);
        }
        log.info("Outbox: ligne {} remise en attente", id);
    }

    public int purgeProcessedOlderThan(Duration retention) {
        int n = outboxRepo.purgeProcessedBefore(Instant.now().minus(retention));
        if (n > 0) log.info("Outbox: {} lignes traitées purgées", n);
        return n;
    }
}
