package org.relaychat.repo;

import org.relaychat.model.UserAccount;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {
    Optional<UserAccount> findByEmail(String email);

    boolean existsByEmail(String email);

    boolean existsByUsername(String username);

    @Query("select u from UserAccount u where lower(u.username) like lower(concat('%', :q, '%')) " +
            "or lower(u.displayName) like lower(concat('%', :q, '%')) order by u.username")
    List<UserAccount> search(@Param("q") String query, Pageable pageable);
}
