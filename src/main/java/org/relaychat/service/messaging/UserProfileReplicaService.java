package org.relaychat.service.messaging;

import lombok.RequiredArgsConstructor;
import org.relaychat.events.user.UserEvent;
import org.relaychat.events.user.UserSnapshot;
import org.relaychat.model.UserProfile;
import org.relaychat.repo.ParticipantRepository;
import org.relaychat.repo.UserProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Vue matérialisée des utilisateurs côté messagerie.
 * Chaque application est idempotente : même version = mêmes données, version plus ancienne ignorée.
 */
@Service
@RequiredArgsConstructor
public class UserProfileReplicaService {

    private static final Logger log = LoggerFactory.getLogger(UserProfileReplicaService.class);

    private final UserProfileRepository profileRepo;
    private final ParticipantRepository participantRepo;
    private final ConversationCacheService cache;

    @Transactional
    public ApplyOutcome apply(UserEvent event) {
        ApplyOutcome outcome = switch (event.type()) {
            case USER_CREATED, USER_UPDATED -> upsert(event);
            case USER_DELETED -> tombstone(event);
        };
        if (outcome == ApplyOutcome.APPLIED) {
            invalidateDependents(event.userId());
        } else {
            log.debug("Événement {} ({}) pour {} ignoré: {}", event.eventId(), event.type(), event.userId(), outcome);
        }
        return outcome;
    }

    public Optional<UserProfile> find(Long userId) {
        return profileRepo.findById(userId).filter(p -> !p.isDeleted());
    }

    // écriture conditionnelle en base : deux versions appliquées en parallèle ne peuvent pas se croiser
    private ApplyOutcome upsert(UserEvent event) {
        UserSnapshot data = requireData(event);
        Instant now = Instant.now();
        int written = profileRepo.applySnapshot(event.userId(), data.username(), data.displayName(), data.email(),
                data.avatarUrl(), data.online(), data.lastSeen(), event.version(), now);
        if (written == 0) {
            UserProfile existing = profileRepo.findById(event.userId()).orElse(null);
            if (existing != null) {
                return existing.isDeleted() ? ApplyOutcome.TOMBSTONED : ApplyOutcome.STALE;
            }
            // une mise à jour peut arriver avant la création : on insère
            UserProfile profile = UserProfile.builder().userId(event.userId()).fresh(true).build();
            copy(data, profile);
            profile.setSourceVersion(event.version());
            profile.setUpdatedAt(now);
            profileRepo.saveAndFlush(profile);
        }
        log.info("Réplique: profil {} à la version {}", event.userId(), event.version());
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome tombstone(UserEvent event) {
        Instant now = Instant.now();
        if (profileRepo.markDeleted(event.userId(), event.version(), now) == 0) {
            if (profileRepo.existsById(event.userId())) {
                return ApplyOutcome.TOMBSTONED;
            }
            UserProfile profile = UserProfile.builder().userId(event.userId()).fresh(true).build();
            if (event.data() != null) {
                copy(event.data(), profile);
            } else {
                profile.setUsername("deleted-" + event.userId());
            }
            profile.setDeleted(true);
            profile.setOnline(false);
            profile.setSourceVersion(event.version());
            profile.setUpdatedAt(now);
            profileRepo.saveAndFlush(profile);
        }
        log.info("Réplique: profil {} supprimé", event.userId());
        return ApplyOutcome.APPLIED;
    }

    private static UserSnapshot requireData(UserEvent event) {
        if (event.data() == null) {
            throw new IllegalArgumentException("Événement sans données utilisateur");
        }
        return event.data();
    }

    private static void copy(UserSnapshot data, UserProfile profile) {
        profile.setUsername(data.username());
        profile.setDisplayName(data.displayName());
        profile.setEmail(data.email());
        profile.setAvatarUrl(data.avatarUrl());
        profile.setOnline(data.online());
        profile.setLastSeen(data.lastSeen());
    }

    // le sujet et tous ceux qui partagent une conversation avec lui voient son nom dans leur liste
    private void invalidateDependents(Long userId) {
        Set<Long> affected = new LinkedHashSet<>();
        affected.add(userId);
        try {
            affected.addAll(participantRepo.findCoParticipantIds(userId));
        } catch (RuntimeException e) {
            log.warn("Co-participants de {} introuvables, invalidation partielle: {}", userId, e.getMessage());
        }
        cache.invalidate(affected);
    }
}
