package org.relaychat.repo;

import org.relaychat.model.Message;
import org.relaychat.model.MessageStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface MessageRepository extends JpaRepository<Message, Long> {

    Optional<Message> findByIdAndDeletedAtIsNull(Long id);

    List<Message> findByConversationIdAndDeletedAtIsNullOrderByIdDesc(Long conversationId, Pageable pageable);

    Optional<Message> findTopByConversationIdAndDeletedAtIsNullOrderByIdDesc(Long conversationId);

    // messages couverts par un déplacement du pointeur de lecture (oldId, newId]
    @Query("select m from Message m where m.conversationId = :conversationId and m.deletedAt is null " +
            "and m.senderId <> :readerId and m.id > :fromExclusive and m.id <= :toInclusive order by m.id asc")
    List<Message> findCoveredRange(@Param("conversationId") Long conversationId,
                                   @Param("readerId") Long readerId,
                                   @Param("fromExclusive") Long fromExclusive,
                                   @Param("toInclusive") Long toInclusive);

    // compteur de non-lus : parcours d'intervalle sur (conversationId, id)
    @Query("select count(m) from Message m where m.conversationId = :conversationId and m.deletedAt is null " +
            "and m.senderId <> :readerId and m.id > :afterId")
    long countUnread(@Param("conversationId") Long conversationId,
                     @Param("readerId") Long readerId,
                     @Param("afterId") Long afterId);

    @Query("select m from Message m where m.deletedAt is null " +
            "and lower(m.content) like lower(concat('%', :q, '%')) " +
            "and m.conversationId in (select p.conversationId from Participant p where p.userId = :userId) " +
            "order by m.createdAt desc")
    List<Message> search(@Param("userId") Long userId, @Param("q") String query, Pageable pageable);

    // le statut global du message ne fait qu'avancer
    @Modifying
    @Query("update Message m set m.status = org.relaychat.model.MessageStatus.DELIVERED, m.deliveredAt = :now " +
            "where m.id = :id and m.status = org.relaychat.model.MessageStatus.SENT")
    int advanceToDelivered(@Param("id") Long id, @Param("now") Instant now);

    @Modifying
    @Query("update Message m set m.status = org.relaychat.model.MessageStatus.READ, m.readAt = :now, " +
            "m.deliveredAt = coalesce(m.deliveredAt, :now) " +
            "where m.id in :ids and m.status <> org.relaychat.model.MessageStatus.READ")
    int advanceToRead(@Param("ids") Collection<Long> ids, @Param("now") Instant now);

    long countByStatus(MessageStatus status);
}
