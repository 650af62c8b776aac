package org.relaychat.repo;

import org.junit.jupiter.api.Test;
import org.relaychat.model.Conversation;
import org.relaychat.model.ConversationKind;
import org.relaychat.model.Message;
import org.relaychat.model.Participant;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class MessagingRepositoryTest {

    @Autowired
    private TestEntityManager em;

    @Autowired
    private ConversationRepository conversationRepo;

    @Autowired
    private ParticipantRepository participantRepo;

    @Autowired
    private MessageRepository messageRepo;

    private Long conversation(ConversationKind kind, Long... members) {
        Conversation c = em.persist(Conversation.builder().kind(kind).name(kind == ConversationKind.GROUP ? "g" : null)
                .createdBy(members[0]).build());
        for (Long m : members) {
            em.persist(Participant.builder().conversationId(c.getId()).userId(m).build());
        }
        em.flush();
        return c.getId();
    }

    private Long message(Long conversationId, Long sender) {
        return em.persistAndFlush(Message.builder().conversationId(conversationId).senderId(sender).content("m").build()).getId();
    }

    @Test
    void advanceReadPointer_shouldOnlyMoveForward() {
        Long conv = conversation(ConversationKind.DIRECT, 1L, 2L);

        assertThat(participantRepo.advanceReadPointer(conv, 2L, 10L, Instant.now())).isEqualTo(1);
        assertThat(participantRepo.advanceReadPointer(conv, 2L, 10L, Instant.now())).isZero();
        assertThat(participantRepo.advanceReadPointer(conv, 2L, 7L, Instant.now())).isZero();
        assertThat(participantRepo.advanceReadPointer(conv, 2L, 12L, Instant.now())).isEqualTo(1);

        em.clear();
        assertThat(participantRepo.findByConversationIdAndUserId(conv, 2L))
                .get().extracting(Participant::getLastReadMessageId).isEqualTo(12L);
    }

    @Test
    void findCoParticipantIds_shouldSpanAllConversationsOfUser() {
        conversation(ConversationKind.DIRECT, 1L, 2L);
        conversation(ConversationKind.GROUP, 1L, 3L, 4L);
        conversation(ConversationKind.DIRECT, 5L, 6L);

        assertThat(participantRepo.findCoParticipantIds(1L)).containsExactlyInAnyOrder(1L, 2L, 3L, 4L);
    }

    @Test
    void findDirectBetween_shouldIgnoreGroups() {
        Long direct = conversation(ConversationKind.DIRECT, 1L, 2L);
        conversation(ConversationKind.GROUP, 1L, 2L);

        assertThat(conversationRepo.findDirectBetween(ConversationKind.DIRECT, 2L, 1L))
                .extracting(Conversation::getId).containsExactly(direct);
        assertThat(conversationRepo.findDirectBetween(ConversationKind.DIRECT, 1L, 3L)).isEmpty();
    }

    @Test
    void countUnread_shouldSkipOwnDeletedAndAlreadyRead() {
        Long conv = conversation(ConversationKind.DIRECT, 1L, 2L);
        Long m1 = message(conv, 1L);
        message(conv, 1L);
        message(conv, 2L);
        Long deleted = message(conv, 1L);
        em.find(Message.class, deleted).setDeletedAt(Instant.now());
        em.flush();

        assertThat(messageRepo.countUnread(conv, 2L, 0L)).isEqualTo(2);
        assertThat(messageRepo.countUnread(conv, 2L, m1)).isEqualTo(1);
        assertThat(messageRepo.findCoveredRange(conv, 2L, 0L, deleted)).hasSize(2);
    }

    @Test
    void advanceToRead_shouldNeverDowngrade() {
        Long conv = conversation(ConversationKind.DIRECT, 1L, 2L);
        Long m = message(conv, 1L);

        assertThat(messageRepo.advanceToRead(List.of(m), Instant.now())).isEqualTo(1);
        assertThat(messageRepo.advanceToDelivered(m, Instant.now())).isZero();
        assertThat(messageRepo.advanceToRead(List.of(m), Instant.now())).isZero();
    }
}
