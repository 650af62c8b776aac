package org.relaychat.repo;

import org.relaychat.model.Conversation;
import org.relaychat.model.ConversationKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface ConversationRepository extends JpaRepository<Conversation, Long> {

    @Query("select c from Conversation c where c.id in " +
            "(select p.conversationId from Participant p where p.userId = :userId)")
    List<Conversation> findForUser(@Param("userId") Long userId);

    // conversation directe existante entre deux utilisateurs
    @Query("select c from Conversation c where c.kind = :kind " +
            "and exists (select p1 from Participant p1 where p1.conversationId = c.id and p1.userId = :a) " +
            "and exists (select p2 from Participant p2 where p2.conversationId = c.id and p2.userId = :b) " +
            "and (select count(p3) from Participant p3 where p3.conversationId = c.id) = 2")
    List<Conversation> findDirectBetween(@Param("kind") ConversationKind kind, @Param("a") Long a, @Param("b") Long b);

    @Modifying
    @Query("update Conversation c set c.updatedAt = :now where c.id = :id")
    int touch(@Param("id") Long id, @Param("now") Instant now);
}
