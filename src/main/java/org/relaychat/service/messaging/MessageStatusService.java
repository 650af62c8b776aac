package org.relaychat.service.messaging;

import lombok.RequiredArgsConstructor;
import org.relaychat.dto.ConversationReadResult;
import org.relaychat.dto.ReadStatus;
import org.relaychat.dto.StatusSyncRequest;
import org.relaychat.dto.StatusSyncResult;
import org.relaychat.dto.StatusTransition;
import org.relaychat.events.chat.ChatEvent;
import org.relaychat.exception.InvalidOperationException;
import org.relaychat.exception.NotFoundException;
import org.relaychat.model.Message;
import org.relaychat.model.MessageStatus;
import org.relaychat.model.MessageStatusEvent;
import org.relaychat.model.Participant;
import org.relaychat.repo.MessageRepository;
import org.relaychat.repo.MessageStatusEventRepository;
import org.relaychat.repo.ParticipantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statut de chaque message par destinataire : SENT, puis DELIVERED, puis READ, jamais en arrière.
 * Chaque transition ajoute une ligne au journal {@link MessageStatusEvent}.
 */
@Service
@RequiredArgsConstructor
public class MessageStatusService {

    private static final Logger log = LoggerFactory.getLogger(MessageStatusService.class);

    private final MessageRepository messageRepo;
    private final MessageStatusEventRepository statusEventRepo;
    private final ParticipantRepository participantRepo;
    private final ConversationService conversationService;
    private final ConversationCacheService cache;
    private final ApplicationEventPublisher events;

    @Transactional
    public StatusTransition markDelivered(Long messageId, Long userId, String deviceId) {
        return transition(messageId, userId, MessageStatus.DELIVERED, deviceId);
    }

    @Transactional
    public StatusTransition markRead(Long messageId, Long userId, String deviceId) {
        return transition(messageId, userId, MessageStatus.READ, deviceId);
    }

    /** Statut courant du destinataire : le plus haut du journal, SENT s'il n'y a rien. */
    public MessageStatus currentStatus(Long messageId, Long userId) {
        return statusEventRepo.findByMessageIdAndUserId(messageId, userId).stream()
                .map(MessageStatusEvent::getStatus)
                .reduce(MessageStatus.SENT, MessageStatus::max);
    }

    /**
     * Avance le pointeur de lecture jusqu'au dernier message non supprimé.
     * Sans message plus récent que le pointeur, ne fait rien et renvoie une liste vide.
     */
    @Transactional
    public ConversationReadResult markConversationRead(Long conversationId, Long userId, String deviceId) {
        Participant p = conversationService.requireParticipant(conversationId, userId);
        Message newest = messageRepo.findTopByConversationIdAndDeletedAtIsNullOrderByIdDesc(conversationId).orElse(null);
        if (newest == null) {
            return new ConversationReadResult(conversationId, userId, p.getLastReadMessageId(), List.of());
        }
        return advancePointer(p, newest.getId(), deviceId);
    }

    @Transactional
    public ConversationReadResult markConversationReadUpTo(Long conversationId, Long userId, Long messageId, String deviceId) {
        Participant p = conversationService.requireParticipant(conversationId, userId);
        Message target = messageRepo.findById(messageId)
                .orElseThrow(() -> new NotFoundException("Message introuvable"));
        if (!target.getConversationId().equals(conversationId)) {
            throw new InvalidOperationException("Le message n'appartient pas à cette conversation");
        }
        Long pointer = p.getLastReadMessageId();
        if (pointer != null && messageId < pointer) {
            throw new InvalidOperationException("Le pointeur de lecture ne peut pas reculer");
        }
        return advancePointer(p, messageId, deviceId);
    }

    public long unreadCount(Long conversationId, Long userId) {
        Participant p = conversationService.requireParticipant(conversationId, userId);
        return countUnread(p);
    }

    public ReadStatus readStatus(Long conversationId, Long userId) {
        Participant p = conversationService.requireParticipant(conversationId, userId);
        return new ReadStatus(p.getLastReadMessageId(), p.getLastReadAt(), countUnread(p));
    }

    public List<MessageStatusEvent> statusHistory(Long messageId, Long userId) {
        Message m = messageRepo.findById(messageId).orElseThrow(() -> new NotFoundException("Message introuvable"));
        conversationService.requireParticipant(m.getConversationId(), userId);
        return statusEventRepo.findByMessageIdOrderByTimestampDescIdDesc(messageId);
    }

    public List<MessageStatusEvent> conversationStatusHistory(Long conversationId, Long userId, int limit) {
        conversationService.requireParticipant(conversationId, userId);
        return statusEventRepo.findByConversationIdOrderByTimestampDescIdDesc(conversationId,
                PageRequest.of(0, Math.min(Math.max(limit, 1), 200)));
    }

    /**
     * Rejoue les statuts constatés hors ligne par un appareil, puis renvoie les transitions
     * survenues côté serveur depuis {@code lastSync} (100 au plus).
     * Une entrée refusée (message inconnu, hors conversation, propre message, statut SENT) compte
     * comme échec sans interrompre le lot.
     */
    @Transactional
    public StatusSyncResult syncStatus(Long userId, String deviceId, Instant lastSync, List<StatusSyncRequest.Update> updates) {
        int processed = 0;
        int failed = 0;
        List<StatusSyncResult.Conflict> conflicts = new ArrayList<>();

        for (StatusSyncRequest.Update u : updates) {
            Message m = u.getMessageId() == null ? null
                    : messageRepo.findByIdAndDeletedAtIsNull(u.getMessageId()).orElse(null);
            if (!acceptable(u, m, userId)) {
                log.debug("Synchro {}: statut {} refusé pour le message {}", userId, u.getStatus(), u.getMessageId());
                failed++;
                continue;
            }
            // constaté avant l'existence du message : l'appareil se trompe, on ne touche à rien
            if (u.getTimestamp() != null && u.getTimestamp().isBefore(m.getCreatedAt())) {
                conflicts.add(new StatusSyncResult.Conflict(m.getId(), currentStatus(m.getId(), userId), u.getStatus(), false));
                continue;
            }
            StatusTransition t = transition(m.getId(), userId, u.getStatus(), deviceId);
            if (t.current() != u.getStatus()) {
                conflicts.add(new StatusSyncResult.Conflict(m.getId(), t.current(), u.getStatus(), true));
            }
            processed++;
        }

        List<StatusSyncResult.ServerUpdate> serverUpdates = lastSync == null ? List.of()
                : statusEventRepo.findVisibleSince(userId, lastSync, PageRequest.of(0, 100)).stream()
                .map(e -> new StatusSyncResult.ServerUpdate(e.getMessageId(), e.getConversationId(), e.getUserId(),
                        e.getStatus(), e.getTimestamp()))
                .toList();

        log.info("Synchro des statuts de {} ({}): {} traités, {} échecs, {} conflits",
                userId, deviceId, processed, failed, conflicts.size());
        return new StatusSyncResult(failed == 0, processed, failed, conflicts, serverUpdates);
    }

    private boolean acceptable(StatusSyncRequest.Update u, Message m, Long userId) {
        if (m == null || u.getStatus() == null || u.getStatus() == MessageStatus.SENT) {
            return false;
        }
        if (u.getConversationId() != null && !u.getConversationId().equals(m.getConversationId())) {
            return false;
        }
        return !m.getSenderId().equals(userId)
                && participantRepo.existsByConversationIdAndUserId(m.getConversationId(), userId);
    }

    private StatusTransition transition(Long messageId, Long userId, MessageStatus target, String deviceId) {
        Message m = messageRepo.findByIdAndDeletedAtIsNull(messageId)
                .orElseThrow(() -> new NotFoundException("Message introuvable"));
        conversationService.requireParticipant(m.getConversationId(), userId);
        if (m.getSenderId().equals(userId)) {
            throw new InvalidOperationException("Impossible de changer le statut de son propre message");
        }
        // deux appareils du même destinataire passent l'un après l'autre : lecture du journal puis ajout
        participantRepo.lockMembership(m.getConversationId(), userId);

        MessageStatus current = currentStatus(messageId, userId);
        if (current.isAtLeast(target)) {
            log.debug("Message {} déjà {} pour {}, {} ignoré", messageId, current, userId, target);
            return new StatusTransition(messageId, userId, current, current, StatusTransition.Outcome.ALREADY_AT_OR_BEYOND);
        }

        Instant now = Instant.now();
        statusEventRepo.save(MessageStatusEvent.builder()
                .messageId(messageId)
                .conversationId(m.getConversationId())
                .userId(userId)
                .status(target)
                .previousStatus(current)
                .timestamp(now)
                .deviceId(deviceId)
                .build());

        if (target == MessageStatus.DELIVERED) {
            messageRepo.advanceToDelivered(messageId, now);
            events.publishEvent(new ChatEvent.MessageDelivered(messageId, m.getConversationId(), userId, now));
        } else {
            messageRepo.advanceToRead(List.of(messageId), now);
            events.publishEvent(new ChatEvent.MessageRead(messageId, m.getConversationId(), userId, now));
        }
        cache.invalidate(userId);
        log.debug("Message {}: {} -> {} pour {}", messageId, current, target, userId);
        return new StatusTransition(messageId, userId, current, target, StatusTransition.Outcome.APPLIED);
    }

    private ConversationReadResult advancePointer(Participant p, Long newPointer, String deviceId) {
        Long conversationId = p.getConversationId();
        Long userId = p.getUserId();
        Long oldPointer = p.getLastReadMessageId();
        Instant now = Instant.now();

        // mise à jour conditionnelle : 0 ligne si le pointeur est déjà à newPointer ou au-delà
        if (participantRepo.advanceReadPointer(conversationId, userId, newPointer, now) == 0) {
            log.debug("Pointeur de {} dans {} déjà à {} ou au-delà", userId, conversationId, newPointer);
            return new ConversationReadResult(conversationId, userId, oldPointer, List.of());
        }

        List<Message> covered = messageRepo.findCoveredRange(conversationId, userId,
                oldPointer == null ? 0L : oldPointer, newPointer);
        Map<Long, MessageStatus> current = new HashMap<>();
        if (!covered.isEmpty()) {
            for (MessageStatusEvent e : statusEventRepo.findForRecipient(userId, covered.stream().map(Message::getId).toList())) {
                current.merge(e.getMessageId(), e.getStatus(), MessageStatus::max);
            }
        }

        List<MessageStatusEvent> audit = covered.stream()
                .filter(m -> current.getOrDefault(m.getId(), MessageStatus.SENT) != MessageStatus.READ)
                .map(m -> MessageStatusEvent.builder()
                        .messageId(m.getId())
                        .conversationId(conversationId)
                        .userId(userId)
                        .status(MessageStatus.READ)
                        .previousStatus(current.getOrDefault(m.getId(), MessageStatus.SENT))
                        .timestamp(now)
                        .deviceId(deviceId)
                        .build())
                .toList();
        List<Long> newlyRead = audit.stream().map(MessageStatusEvent::getMessageId).toList();

        if (!audit.isEmpty()) {
            statusEventRepo.saveAll(audit);
            messageRepo.advanceToRead(newlyRead, now);
        }
        events.publishEvent(new ChatEvent.ConversationRead(conversationId, userId, newlyRead, newPointer, now));
        cache.invalidate(conversationService.participantIds(conversationId));
        log.debug("Conversation {} lue par {} jusqu'à {} ({} nouveaux)", conversationId, userId, newPointer, newlyRead.size());
        return new ConversationReadResult(conversationId, userId, newPointer, newlyRead);
    }

    private long countUnread(Participant p) {
        Long pointer = p.getLastReadMessageId();
        return messageRepo.countUnread(p.getConversationId(), p.getUserId(), pointer == null ? 0L : pointer);
    }
}
