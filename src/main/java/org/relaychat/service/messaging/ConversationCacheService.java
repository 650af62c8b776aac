package org.relaychat.service.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.relaychat.dto.ConversationSummary;
import org.relaychat.kv.KvClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Cache de lecture {@code conversation-list:{userId}} à durée de vie courte.
 * Une écriture supprime l'entrée, elle ne la corrige jamais. Les erreurs Redis sont
 * journalisées et traitées comme un défaut de cache.
 */
@Service
public class ConversationCacheService {

    private static final Logger log = LoggerFactory.getLogger(ConversationCacheService.class);
    private static final String PREFIX = "conversation-list:";
    private static final TypeReference<List<ConversationSummary>> LIST_TYPE = new TypeReference<>() {};

    private final KvClient kv;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public ConversationCacheService(KvClient kv,
                                    ObjectMapper objectMapper,
                                    @Value("${app.cache.conversation-list-ttl-seconds:300}") long ttlSeconds) {
        this.kv = kv;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public static String key(Long userId) {
        return PREFIX + userId;
    }

    public List<ConversationSummary> getOrLoad(Long userId, Supplier<List<ConversationSummary>> loader) {
        Optional<List<ConversationSummary>> cached = get(userId);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<ConversationSummary> fresh = loader.get();
        put(userId, fresh);
        return fresh;
    }

    public Optional<List<ConversationSummary>> get(Long userId) {
        String raw;
        try {
            raw = kv.get(key(userId)).orElse(null);
        } catch (RuntimeException e) {
            log.warn("Lecture du cache {} impossible: {}", key(userId), e.getMessage());
            return Optional.empty();
        }
        if (raw == null) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(raw, LIST_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("Entrée {} illisible, ignorée", key(userId));
            return Optional.empty();
        }
    }

    public void put(Long userId, List<ConversationSummary> summaries) {
        try {
            kv.set(key(userId), objectMapper.writeValueAsString(summaries), ttl);
        } catch (JsonProcessingException e) {
            log.warn("Liste de conversations de {} non sérialisable", userId, e);
        } catch (RuntimeException e) {
            log.warn("Écriture du cache {} impossible: {}", key(userId), e.getMessage());
        }
    }

    public void invalidate(Long userId) {
        invalidate(List.of(userId));
    }

    /**
     * Supprime les entrées des utilisateurs donnés. Dans une transaction, la suppression a lieu
     * après le commit, pour qu'une lecture concurrente ne remette pas en cache l'état d'avant.
     */
    public void invalidate(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) return;
        Set<String> keys = new LinkedHashSet<>();
        for (Long id : userIds) {
            if (id != null) keys.add(key(id));
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    delete(keys);
                }
            });
        } else {
            delete(keys);
        }
    }

    private void delete(Set<String> keys) {
        try {
            kv.del(keys);
            log.debug("Cache invalidé: {}", keys);
        } catch (RuntimeException e) {
            log.warn("Invalidation du cache impossible pour {}: {}", keys, e.getMessage());
        }
    }
}
