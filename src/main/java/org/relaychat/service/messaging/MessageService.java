package org.relaychat.service.messaging;

import lombok.RequiredArgsConstructor;
import org.relaychat.dto.MessageView;
import org.relaychat.events.chat.ChatEvent;
import org.relaychat.exception.ForbiddenOperationException;
import org.relaychat.exception.InvalidOperationException;
import org.relaychat.exception.NotFoundException;
import org.relaychat.model.Message;
import org.relaychat.repo.ConversationRepository;
import org.relaychat.repo.MessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
@RequiredArgsConstructor
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    public static final int MAX_CONTENT_LENGTH = 4000;
    public static final Duration EDIT_WINDOW = Duration.ofHours(24);
    private static final int MAX_PAGE = 100;

    private final MessageRepository messageRepo;
    private final ConversationRepository conversationRepo;
    private final ConversationService conversationService;
    private final ConversationCacheService cache;
    private final ApplicationEventPublisher events;

    @Transactional
    public MessageView sendMessage(Long senderId, Long conversationId, String content, String messageType, Long replyTo) {
        conversationService.requireParticipant(conversationId, senderId);
        String text = validContent(content);
        if (replyTo != null) {
            Message parent = messageRepo.findById(replyTo)
                    .orElseThrow(() -> new NotFoundException("Message cité introuvable"));
            if (!parent.getConversationId().equals(conversationId)) {
                throw new InvalidOperationException("Le message cité n'appartient pas à cette conversation");
            }
        }

        Instant now = Instant.now();
        Message saved = messageRepo.save(Message.builder()
                .conversationId(conversationId)
                .senderId(senderId)
                .content(text)
                .messageType(messageType == null || messageType.isBlank() ? "text" : messageType)
                .replyTo(replyTo)
                .createdAt(now)
                .build());
        conversationRepo.touch(conversationId, now);

        MessageView view = MessageView.of(saved);
        events.publishEvent(new ChatEvent.NewMessage(view));
        cache.invalidate(conversationService.participantIds(conversationId));
        log.debug("Message {} envoyé par {} dans {}", saved.getId(), senderId, conversationId);
        return view;
    }

    @Transactional
    public MessageView editMessage(Long messageId, Long userId, String content) {
        Message m = ownMessage(messageId, userId);
        if (m.getCreatedAt().plus(EDIT_WINDOW).isBefore(Instant.now())) {
            throw new InvalidOperationException("Un message ne peut plus être modifié après 24 heures");
        }
        m.setContent(validContent(content));
        m.setEditedAt(Instant.now());
        Message saved = messageRepo.save(m);

        MessageView view = MessageView.of(saved);
        events.publishEvent(new ChatEvent.MessageUpdated(view));
        cache.invalidate(conversationService.participantIds(saved.getConversationId()));
        return view;
    }

    @Transactional
    public void deleteMessage(Long messageId, Long userId) {
        Message m = ownMessage(messageId, userId);
        m.setDeletedAt(Instant.now());
        messageRepo.save(m);

        events.publishEvent(new ChatEvent.MessageDeleted(messageId, m.getConversationId(), userId));
        cache.invalidate(conversationService.participantIds(m.getConversationId()));
        log.debug("Message {} supprimé par {}", messageId, userId);
    }

    /** Page de messages, du plus ancien au plus récent ; {@code offset} compte depuis le plus récent. */
    public List<MessageView> messages(Long conversationId, Long userId, int limit, int offset) {
        conversationService.requireParticipant(conversationId, userId);
        int size = Math.min(Math.max(limit, 1), MAX_PAGE);
        int skip = Math.max(offset, 0);
        List<Message> newestFirst = messageRepo.findByConversationIdAndDeletedAtIsNullOrderByIdDesc(
                conversationId, PageRequest.of(0, skip + size));
        List<MessageView> page = new ArrayList<>(newestFirst.stream().skip(skip).map(MessageView::of).toList());
        Collections.reverse(page);
        return page;
    }

    public List<MessageView> search(Long userId, String query, int limit) {
        if (query == null || query.trim().length() < 2) {
            throw new IllegalArgumentException("La recherche demande au moins 2 caractères");
        }
        return messageRepo.search(userId, query.trim(), PageRequest.of(0, Math.min(Math.max(limit, 1), MAX_PAGE)))
                .stream().map(MessageView::of).toList();
    }

    private Message ownMessage(Long messageId, Long userId) {
        Message m = messageRepo.findByIdAndDeletedAtIsNull(messageId)
                .orElseThrow(() -> new NotFoundException("Message introuvable"));
        if (!m.getSenderId().equals(userId)) {
            throw new ForbiddenOperationException("Seul l'expéditeur peut modifier ce message");
        }
        return m;
    }

    private static String validContent(String content) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Le message est vide");
        }
        String text = content.trim();
        if (text.length() > MAX_CONTENT_LENGTH) {
            throw new IllegalArgumentException("Le message dépasse " + MAX_CONTENT_LENGTH + " caractères");
        }
        return text;
    }
}
