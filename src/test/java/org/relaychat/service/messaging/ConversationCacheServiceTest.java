package org.relaychat.service.messaging;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.relaychat.dto.ConversationSummary;
import org.relaychat.kv.InMemoryKvClient;
import org.relaychat.kv.KvClient;
import org.relaychat.model.ConversationKind;
import org.relaychat.support.MutableClock;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversationCacheServiceTest {

    private MutableClock clock;
    private InMemoryKvClient kv;
    private ConversationCacheService cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        kv = new InMemoryKvClient(clock);
        cache = new ConversationCacheService(kv, new ObjectMapper().findAndRegisterModules(), 300);
    }

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    private static List<ConversationSummary> one(String name) {
        return List.of(ConversationSummary.builder().id(1L).kind(ConversationKind.GROUP).name(name)
                .participants(List.of()).lastActivity(Instant.EPOCH).build());
    }

    @Test
    void getOrLoad_shouldLoadOnceThenServeFromCache() {
        AtomicInteger loads = new AtomicInteger();

        cache.getOrLoad(5L, () -> { loads.incrementAndGet(); return one("projet"); });
        List<ConversationSummary> again = cache.getOrLoad(5L, () -> { loads.incrementAndGet(); return one("autre"); });

        assertThat(loads).hasValue(1);
        assertThat(again).extracting(ConversationSummary::getName).containsExactly("projet");
    }

    @Test
    void entry_shouldExpireAfterTtl() {
        cache.put(5L, one("projet"));

        clock.advance(Duration.ofSeconds(301));

        assertThat(cache.get(5L)).isEmpty();
    }

    @Test
    void corruptEntry_shouldBeTreatedAsMiss() {
        kv.set(ConversationCacheService.key(5L), "{pas du json", Duration.ofMinutes(5));

        assertThat(cache.get(5L)).isEmpty();
    }

    @Test
    void invalidate_insideTransaction_shouldWaitForCommit() {
        cache.put(5L, one("projet"));
        TransactionSynchronizationManager.initSynchronization();

        cache.invalidate(5L);
        assertThat(kv.exists(ConversationCacheService.key(5L))).isTrue();

        for (TransactionSynchronization s : TransactionSynchronizationManager.getSynchronizations()) {
            s.afterCommit();
        }
        assertThat(kv.exists(ConversationCacheService.key(5L))).isFalse();
    }

    @Test
    void redisDown_shouldFallBackToLoader() {
        KvClient broken = mock(KvClient.class);
        when(broken.get(anyString())).thenThrow(new RedisConnectionFailureException("down"));
        ConversationCacheService degraded = new ConversationCacheService(broken, new ObjectMapper().findAndRegisterModules(), 300);

        assertThat(degraded.getOrLoad(5L, () -> one("projet"))).hasSize(1);
    }
}
