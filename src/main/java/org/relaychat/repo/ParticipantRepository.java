package org.relaychat.repo;

import jakarta.persistence.LockModeType;
import org.relaychat.model.Participant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ParticipantRepository extends JpaRepository<Participant, Long> {

    Optional<Participant> findByConversationIdAndUserId(Long conversationId, Long userId);

    // verrou de ligne tenu jusqu'à la fin de la transaction
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Participant p where p.conversationId = :conversationId and p.userId = :userId")
    Optional<Participant> lockMembership(@Param("conversationId") Long conversationId, @Param("userId") Long userId);

    boolean existsByConversationIdAndUserId(Long conversationId, Long userId);

    List<Participant> findByConversationId(Long conversationId);

    List<Participant> findByConversationIdIn(List<Long> conversationIds);

    long countByConversationId(Long conversationId);

    @Query("select p.userId from Participant p where p.conversationId = :conversationId")
    List<Long> findUserIdsByConversationId(@Param("conversationId") Long conversationId);

    // tous les utilisateurs partageant au moins une conversation avec userId (lui compris)
    @Query("select distinct p2.userId from Participant p1, Participant p2 " +
            "where p1.userId = :userId and p2.conversationId = p1.conversationId")
    List<Long> findCoParticipantIds(@Param("userId") Long userId);

    // avance le pointeur de lecture, jamais en arrière : 0 ligne modifiée si newId <= pointeur actuel
    @Modifying
    @Query("update Participant p set p.lastReadMessageId = :newId, p.lastReadAt = :now " +
            "where p.conversationId = :conversationId and p.userId = :userId " +
            "and (p.lastReadMessageId is null or p.lastReadMessageId < :newId)")
    int advanceReadPointer(@Param("conversationId") Long conversationId,
                           @Param("userId") Long userId,
                           @Param("newId") Long newId,
                           @Param("now") Instant now);

    @Modifying
    @Query("delete from Participant p where p.conversationId = :conversationId and p.userId = :userId")
    int deleteByConversationIdAndUserId(@Param("conversationId") Long conversationId, @Param("userId") Long userId);
}
