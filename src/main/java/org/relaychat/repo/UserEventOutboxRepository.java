package org.relaychat.repo;

import org.relaychat.model.UserEventOutbox;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface UserEventOutboxRepository extends JpaRepository<UserEventOutbox, Long> {

    // lignes en attente, dans l'ordre de création (les lignes mortes ne sont plus relayées)
    @Query("select e from UserEventOutbox e where e.processed = false and e.deadAt is null order by e.createdAt asc, e.id asc")
    List<UserEventOutbox> findPending(Pageable pageable);

    List<UserEventOutbox> findByDeadAtIsNotNullOrderByDeadAtDesc(Pageable pageable);

    List<UserEventOutbox> findBySubjectIdOrderByIdAsc(Long subjectId);

    @Transactional
    @Modifying
    @Query("update UserEventOutbox e set e.processed = true, e.processedAt = :now where e.id = :id and e.processed = false")
    int markProcessed(@Param("id") Long id, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("update UserEventOutbox e set e.attempts = e.attempts + 1, e.lastError = :error where e.id = :id and e.processed = false")
    int recordFailure(@Param("id") Long id, @Param("error") String error);

    @Transactional
    @Modifying
    @Query("update UserEventOutbox e set e.deadAt = :now where e.id = :id and e.processed = false and e.deadAt is null")
    int markDead(@Param("id") Long id, @Param("now") Instant now);

    @Transactional
    @Modifying
    @Query("update UserEventOutbox e set e.deadAt = null, e.attempts = 0, e.lastError = null where e.id = :id and e.deadAt is not null")
    int replay(@Param("id") Long id);

    @Transactional
    @Modifying
    @Query("delete from UserEventOutbox e where e.processed = true and e.processedAt < :cutoff")
    int purgeProcessedBefore(@Param("cutoff") Instant cutoff);

    long countByProcessed(boolean processed);

    long countByDeadAtIsNotNull();
}
