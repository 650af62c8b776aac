package org.relaychat.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.relaychat.broker.EventPublisher;
import org.relaychat.dto.ConversationSummary;
import org.relaychat.events.user.UserSnapshot;
import org.relaychat.events.user.UserUpdated;
import org.relaychat.kv.InMemoryKvClient;
import org.relaychat.model.UserEventOutbox;
import org.relaychat.model.UserEventType;
import org.relaychat.model.UserProfile;
import org.relaychat.repo.ParticipantRepository;
import org.relaychat.repo.ProfileStoreStub;
import org.relaychat.repo.UserEventOutboxRepository;
import org.relaychat.repo.UserProfileRepository;
import org.relaychat.service.identity.OutboxRelayService;
import org.relaychat.service.identity.RelayCycle;
import org.relaychat.service.messaging.ConversationCacheService;
import org.relaychat.service.messaging.UserEventSubscriber;
import org.relaychat.service.messaging.UserProfileReplicaService;
import org.relaychat.service.support.RetryPolicy;
import org.springframework.data.domain.Pageable;
import org.springframework.data.redis.connection.DefaultMessage;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Chaîne complète d'un renommage : ligne d'outbox, relais, abonné, réplique, cache des listes.
 * Le broker est remplacé par un appel direct de l'abonné.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RenamePropagationTest {

    private static final Long ALICE = 1L;
    private static final Long BOB = 2L;

    @Mock
    private UserEventOutboxRepository outboxRepo;

    @Mock
    private UserProfileRepository profileRepo;

    @Mock
    private ParticipantRepository participantRepo;

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final Map<Long, UserProfile> profiles = new HashMap<>();
    private InMemoryKvClient kv;
    private ConversationCacheService cache;
    private UserEventSubscriber subscriber;

    @BeforeEach
    void setUp() {
        ProfileStoreStub.install(profileRepo, profiles);
        when(participantRepo.findCoParticipantIds(ALICE)).thenReturn(List.of(ALICE, BOB));

        kv = new InMemoryKvClient(Clock.systemUTC());
        cache = new ConversationCacheService(kv, mapper, 300);
        UserProfileReplicaService replica = new UserProfileReplicaService(profileRepo, participantRepo, cache);
        subscriber = new UserEventSubscriber(replica, mapper, RetryPolicy.none(), 3);

        profiles.put(ALICE, UserProfile.builder().userId(ALICE).username("alice").displayName("Alice").sourceVersion(0).build());
    }

    @Test
    void rename_shouldReachReplicaAndDropCachedListsOfCoParticipants() throws Exception {
        cache.put(ALICE, List.of(new ConversationSummary()));
        cache.put(BOB, List.of(new ConversationSummary()));
        cache.put(99L, List.of(new ConversationSummary()));

        UserUpdated renamed = new UserUpdated("evt-9", ALICE, Instant.now(), 1,
                new UserSnapshot(ALICE, "alice", "alice@test.io", "Alice Martin", null, false, null, Instant.EPOCH, Instant.now()),
                List.of("displayName"));
        UserEventOutbox row = UserEventOutbox.builder()
                .id(10L).subjectId(ALICE).eventType(UserEventType.USER_UPDATED)
                .payload(mapper.writeValueAsString(renamed)).build();
        when(outboxRepo.findPending(any(Pageable.class))).thenReturn(List.of(row));
        when(outboxRepo.markProcessed(eq(10L), any())).thenReturn(1);

        EventPublisher broker = (channel, payload) -> subscriber.onMessage(
                new DefaultMessage(channel.getBytes(StandardCharsets.UTF_8), payload.getBytes(StandardCharsets.UTF_8)), null);
        OutboxRelayService relay = new OutboxRelayService(outboxRepo, broker, RetryPolicy.none(), 50, 5, 20);

        RelayCycle cycle = relay.processNow();

        assertThat(cycle.published()).isEqualTo(1);
        assertThat(profiles.get(ALICE).getDisplayName()).isEqualTo("Alice Martin");
        assertThat(profiles.get(ALICE).getSourceVersion()).isEqualTo(1);
        assertThat(kv.exists(ConversationCacheService.key(ALICE))).isFalse();
        assertThat(kv.exists(ConversationCacheService.key(BOB))).isFalse();
        assertThat(kv.exists(ConversationCacheService.key(99L))).isTrue();
        assertThat(subscriber.status().applied()).isEqualTo(1);
    }

    @Test
    void redelivery_shouldLeaveReplicaUnchanged() throws Exception {
        UserUpdated renamed = new UserUpdated("evt-9", ALICE, Instant.now(), 1,
                new UserSnapshot(ALICE, "alice", "alice@test.io", "Alice Martin", null, false, null, Instant.EPOCH, Instant.now()),
                List.of("displayName"));
        byte[] body = mapper.writeValueAsBytes(renamed);
        DefaultMessage message = new DefaultMessage("user_events".getBytes(StandardCharsets.UTF_8), body);

        subscriber.onMessage(message, null);
        subscriber.onMessage(message, null);

        assertThat(profiles.get(ALICE).getDisplayName()).isEqualTo("Alice Martin");
        assertThat(profiles.get(ALICE).getSourceVersion()).isEqualTo(1);
    }
}
