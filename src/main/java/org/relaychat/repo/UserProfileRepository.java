package org.relaychat.repo;

import org.relaychat.model.UserProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface UserProfileRepository extends JpaRepository<UserProfile, Long> {
    List<UserProfile> findByUserIdInAndDeletedFalse(Collection<Long> userIds);

    // écrit l'instantané seulement si la ligne n'est pas plus récente ni supprimée ; 0 sinon (ou si absente)
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UserProfile p set p.username = :username, p.displayName = :displayName, p.email = :email, " +
            "p.avatarUrl = :avatarUrl, p.online = :online, p.lastSeen = :lastSeen, " +
            "p.sourceVersion = :version, p.updatedAt = :now " +
            "where p.userId = :userId and p.deleted = false and p.sourceVersion <= :version")
    int applySnapshot(@Param("userId") Long userId,
                      @Param("username") String username,
                      @Param("displayName") String displayName,
                      @Param("email") String email,
                      @Param("avatarUrl") String avatarUrl,
                      @Param("online") boolean online,
                      @Param("lastSeen") Instant lastSeen,
                      @Param("version") long version,
                      @Param("now") Instant now);

    // pose la pierre tombale ; la version ne recule jamais
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UserProfile p set p.deleted = true, p.online = false, p.updatedAt = :now, " +
            "p.sourceVersion = case when p.sourceVersion < :version then :version else p.sourceVersion end " +
            "where p.userId = :userId and p.deleted = false")
    int markDeleted(@Param("userId") Long userId, @Param("version") long version, @Param("now") Instant now);
}
