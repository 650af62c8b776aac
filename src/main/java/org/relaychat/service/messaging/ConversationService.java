package org.relaychat.service.messaging;

import lombok.RequiredArgsConstructor;
import org.relaychat.dto.ConversationSummary;
import org.relaychat.dto.MessageView;
import org.relaychat.dto.ParticipantView;
import org.relaychat.events.chat.ChatEvent;
import org.relaychat.exception.ForbiddenOperationException;
import org.relaychat.exception.InvalidOperationException;
import org.relaychat.exception.NotFoundException;
import org.relaychat.model.Conversation;
import org.relaychat.model.ConversationKind;
import org.relaychat.model.Message;
import org.relaychat.model.Participant;
import org.relaychat.model.ParticipantRole;
import org.relaychat.model.UserProfile;
import org.relaychat.repo.ConversationRepository;
import org.relaychat.repo.MessageRepository;
import org.relaychat.repo.ParticipantRepository;
import org.relaychat.repo.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class ConversationService {

    private static final Logger log = LoggerFactory.getLogger(ConversationService.class);

    private final ConversationRepository conversationRepo;
    private final ParticipantRepository participantRepo;
    private final MessageRepository messageRepo;
    private final UserProfileRepository profileRepo;
    private final ConversationCacheService cache;
    private final ApplicationEventPublisher events;

    /**
     * Crée une conversation. Pour une conversation directe déjà existante entre les deux
     * utilisateurs, renvoie celle-ci sans rien créer.
     */
    @Transactional
    public ConversationSummary createConversation(Long creatorId, ConversationKind kind, String name,
                                                  String description, List<Long> participantIds) {
        if (kind == null) {
            throw new IllegalArgumentException("Type de conversation requis");
        }
        Set<Long> others = new LinkedHashSet<>(participantIds == null ? List.of() : participantIds);
        others.remove(creatorId);
        others.remove(null);

        if (kind == ConversationKind.DIRECT) {
            if (others.size() != 1) {
                throw new InvalidOperationException("Une conversation directe se fait avec exactement un autre utilisateur");
            }
            Long other = others.iterator().next();
            List<Conversation> existing = conversationRepo.findDirectBetween(ConversationKind.DIRECT, creatorId, other);
            if (!existing.isEmpty()) {
                return summarize(existing.get(0), creatorId);
            }
        } else {
            if (name == null || name.isBlank()) {
                throw new InvalidOperationException("Un groupe doit avoir un nom");
            }
            if (others.isEmpty()) {
                throw new InvalidOperationException("Un groupe doit avoir au moins un autre participant");
            }
        }
        requireKnownUsers(others);

        Instant now = Instant.now();
        Conversation c = conversationRepo.save(Conversation.builder()
                .kind(kind)
                .name(kind == ConversationKind.GROUP ? name.trim() : null)
                .description(description)
                .createdBy(creatorId)
                .createdAt(now)
                .updatedAt(now)
                .build());

        List<Participant> rows = new ArrayList<>();
        rows.add(Participant.builder().conversationId(c.getId()).userId(creatorId)
                .role(ParticipantRole.ADMIN).joinedAt(now).build());
        for (Long uid : others) {
            rows.add(Participant.builder().conversationId(c.getId()).userId(uid)
                    .role(ParticipantRole.MEMBER).joinedAt(now).build());
        }
        participantRepo.saveAll(rows);

        for (Long uid : others) {
            events.publishEvent(new ChatEvent.ConversationCreated(c.getId(), uid, creatorId, kind.name(), c.getName()));
        }
        Set<Long> everyone = new LinkedHashSet<>(others);
        everyone.add(creatorId);
        cache.invalidate(everyone);
        log.info("Conversation {} ({}) créée par {} avec {}", c.getId(), kind, creatorId, others);
        return summarize(c, creatorId);
    }

    @Transactional
    public ParticipantView addParticipant(Long conversationId, Long actorId, Long userId) {
        Conversation c = find(conversationId);
        requireParticipant(conversationId, actorId);
        if (c.getKind() != ConversationKind.GROUP) {
            throw new InvalidOperationException("On ne peut ajouter un participant qu'à un groupe");
        }
        if (participantRepo.existsByConversationIdAndUserId(conversationId, userId)) {
            throw new InvalidOperationException("Utilisateur déjà participant");
        }
        requireKnownUsers(Set.of(userId));

        Instant now = Instant.now();
        Participant p = participantRepo.save(Participant.builder()
                .conversationId(conversationId).userId(userId)
                .role(ParticipantRole.MEMBER).joinedAt(now).build());
        conversationRepo.touch(conversationId, now);

        events.publishEvent(new ChatEvent.ConversationCreated(conversationId, userId, actorId, c.getKind().name(), c.getName()));
        cache.invalidate(participantRepo.findUserIdsByConversationId(conversationId));
        cache.invalidate(userId);
        log.info("Utilisateur {} ajouté à la conversation {} par {}", userId, conversationId, actorId);
        return toView(p, profileRepo.findById(userId).orElse(null));
    }

    @Transactional
    public void removeParticipant(Long conversationId, Long actorId, Long userId) {
        find(conversationId);
        Participant actor = requireParticipant(conversationId, actorId);
        if (!actorId.equals(userId) && actor.getRole() != ParticipantRole.ADMIN) {
            throw new ForbiddenOperationException("Seul un administrateur peut retirer un autre participant");
        }
        List<Long> before = participantRepo.findUserIdsByConversationId(conversationId);
        if (participantRepo.deleteByConversationIdAndUserId(conversationId, userId) == 0) {
            throw new NotFoundException("Participant introuvable");
        }
        conversationRepo.touch(conversationId, Instant.now());
        cache.invalidate(before);
        log.info("Utilisateur {} retiré de la conversation {} par {}", userId, conversationId, actorId);
    }

    public List<ConversationSummary> listConversations(Long userId) {
        return cache.getOrLoad(userId, () -> buildSummaries(userId));
    }

    public ConversationSummary getConversation(Long conversationId, Long userId) {
        Conversation c = find(conversationId);
        requireParticipant(conversationId, userId);
        return summarize(c, userId);
    }

    public List<ParticipantView> participants(Long conversationId, Long userId) {
        find(conversationId);
        requireParticipant(conversationId, userId);
        List<Participant> rows = participantRepo.findByConversationId(conversationId);
        Map<Long, UserProfile> profiles = profilesOf(rows.stream().map(Participant::getUserId).toList());
        return rows.stream().map(p -> toView(p, profiles.get(p.getUserId()))).toList();
    }

    /**
     * @throws NotFoundException si la conversation n'existe pas
     * @throws ForbiddenOperationException si l'utilisateur n'en fait pas partie
     */
    public Participant requireParticipant(Long conversationId, Long userId) {
        return participantRepo.findByConversationIdAndUserId(conversationId, userId)
                .orElseThrow(() -> conversationRepo.existsById(conversationId)
                        ? new ForbiddenOperationException("Vous ne participez pas à cette conversation")
                        : new NotFoundException("Conversation introuvable"));
    }

    public boolean isParticipant(Long conversationId, Long userId) {
        return participantRepo.existsByConversationIdAndUserId(conversationId, userId);
    }

    public List<Long> participantIds(Long conversationId) {
        return participantRepo.findUserIdsByConversationId(conversationId);
    }

    List<ConversationSummary> buildSummaries(Long userId) {
        List<Conversation> conversations = conversationRepo.findForUser(userId);
        if (conversations.isEmpty()) return List.of();

        List<Long> ids = conversations.stream().map(Conversation::getId).toList();
        Map<Long, List<Participant>> byConversation = participantRepo.findByConversationIdIn(ids).stream()
                .collect(Collectors.groupingBy(Participant::getConversationId));
        Map<Long, UserProfile> profiles = profilesOf(byConversation.values().stream()
                .flatMap(List::stream).map(Participant::getUserId).distinct().toList());

        return conversations.stream()
                .map(c -> summarize(c, userId, byConversation.getOrDefault(c.getId(), List.of()), profiles))
                .sorted(Comparator.comparing(ConversationSummary::getLastActivity, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    private ConversationSummary summarize(Conversation c, Long userId) {
        List<Participant> rows = participantRepo.findByConversationId(c.getId());
        return summarize(c, userId, rows, profilesOf(rows.stream().map(Participant::getUserId).toList()));
    }

    private ConversationSummary summarize(Conversation c, Long userId, List<Participant> rows, Map<Long, UserProfile> profiles) {
        Message last = messageRepo.findTopByConversationIdAndDeletedAtIsNullOrderByIdDesc(c.getId()).orElse(null);
        Long pointer = rows.stream().filter(p -> p.getUserId().equals(userId)).findFirst()
                .map(Participant::getLastReadMessageId).orElse(null);
        long unread = messageRepo.countUnread(c.getId(), userId, pointer == null ? 0L : pointer);

        return ConversationSummary.builder()
                .id(c.getId())
                .kind(c.getKind())
                .name(c.getName())
                .description(c.getDescription())
                .createdBy(c.getCreatedBy())
                .createdAt(c.getCreatedAt())
                .updatedAt(c.getUpdatedAt())
                .participants(rows.stream().map(p -> toView(p, profiles.get(p.getUserId()))).toList())
                .lastMessage(last == null ? null : MessageView.of(last))
                .unreadCount(unread)
                .lastActivity(last != null && last.getCreatedAt().isAfter(c.getUpdatedAt()) ? last.getCreatedAt() : c.getUpdatedAt())
                .build();
    }

    private Conversation find(Long conversationId) {
        return conversationRepo.findById(conversationId)
                .orElseThrow(() -> new NotFoundException("Conversation introuvable"));
    }

    private Map<Long, UserProfile> profilesOf(List<Long> userIds) {
        if (userIds.isEmpty()) return Map.of();
        return profileRepo.findByUserIdInAndDeletedFalse(userIds).stream()
                .collect(Collectors.toMap(UserProfile::getUserId, Function.identity()));
    }

    // les utilisateurs invités doivent être connus de la réplique et non supprimés
    private void requireKnownUsers(Set<Long> userIds) {
        if (userIds.isEmpty()) return;
        Set<Long> known = profileRepo.findByUserIdInAndDeletedFalse(userIds).stream()
                .map(UserProfile::getUserId).collect(Collectors.toSet());
        for (Long id : userIds) {
            if (!known.contains(id)) {
                throw new NotFoundException("Utilisateur " + id + " introuvable");
            }
        }
    }

    private static ParticipantView toView(Participant p, UserProfile profile) {
        ParticipantView.ParticipantViewBuilder b = ParticipantView.builder()
                .userId(p.getUserId())
                .role(p.getRole())
                .joinedAt(p.getJoinedAt());
        if (profile != null) {
            b.username(profile.getUsername())
                    .displayName(profile.getDisplayName())
                    .avatarUrl(profile.getAvatarUrl())
                    .online(profile.isOnline())
                    .lastSeen(profile.getLastSeen());
        }
        return b.build();
    }
}
