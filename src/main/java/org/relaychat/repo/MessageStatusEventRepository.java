package org.relaychat.repo;

import org.relaychat.model.MessageStatus;
import org.relaychat.model.MessageStatusEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Journal en ajout seul : aucune méthode de mise à jour ni de suppression n'est exposée.
 */
public interface MessageStatusEventRepository extends Repository<MessageStatusEvent, Long> {

    MessageStatusEvent save(MessageStatusEvent event);

    List<MessageStatusEvent> saveAll(Iterable<MessageStatusEvent> events);

    List<MessageStatusEvent> findByMessageIdOrderByTimestampDescIdDesc(Long messageId);

    List<MessageStatusEvent> findByConversationIdOrderByTimestampDescIdDesc(Long conversationId, Pageable pageable);

    List<MessageStatusEvent> findByMessageIdAndUserId(Long messageId, Long userId);

    // statuts déjà enregistrés pour un lecteur sur un lot de messages
    @Query("select e from MessageStatusEvent e where e.userId = :userId and e.messageId in :messageIds")
    List<MessageStatusEvent> findForRecipient(@Param("userId") Long userId,
                                              @Param("messageIds") Collection<Long> messageIds);

    // transitions postérieures à since dans les conversations de userId, les plus anciennes d'abord
    @Query("select e from MessageStatusEvent e where e.timestamp > :since and e.conversationId in " +
            "(select p.conversationId from Participant p where p.userId = :userId) " +
            "order by e.timestamp asc, e.id asc")
    List<MessageStatusEvent> findVisibleSince(@Param("userId") Long userId,
                                              @Param("since") Instant since,
                                              Pageable pageable);

    long countByMessageIdAndUserIdAndStatus(Long messageId, Long userId, MessageStatus status);
}
