package org.relaychat.service.identity;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.relaychat.events.user.UserDeleted;
import org.relaychat.events.user.UserEvent;
import org.relaychat.events.user.UserUpdated;
import org.relaychat.model.UserAccount;
import org.relaychat.model.UserEventOutbox;
import org.relaychat.model.UserEventType;
import org.relaychat.repo.UserAccountRepository;
import org.relaychat.repo.UserEventOutboxRepository;
import org.relaychat.security.JwtUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Ligne d'outbox et mutation validées ou annulées ensemble, sur une vraie base (H2).
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({UserService.class, OutboxService.class, JwtUtil.class, OutboxAtomicityTest.Config.class})
class OutboxAtomicityTest {

    @TestConfiguration
    static class Config {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper().findAndRegisterModules();
        }

        @Bean
        PasswordEncoder passwordEncoder() {
            return new BCryptPasswordEncoder(4);
        }
    }

    @Autowired
    private UserService userService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private UserEventOutboxRepository outboxRepo;

    @Autowired
    private UserAccountRepository userRepo;

    @Autowired
    private PlatformTransactionManager txManager;

    @Autowired
    private ObjectMapper objectMapper;

    @AfterEach
    void cleanUp() {
        outboxRepo.deleteAll();
        userRepo.deleteAll();
    }

    @Test
    void register_shouldCommitUserAndEventTogether() {
        UserAccount u = userService.register("alice@test.io", "alice", "secret-1", "Alice");

        List<UserEventOutbox> rows = outboxRepo.findBySubjectIdOrderByIdAsc(u.getId());
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getEventType()).isEqualTo(UserEventType.USER_CREATED);
        assertThat(rows.get(0).isProcessed()).isFalse();
        assertThat(rows.get(0).getPayload()).contains("\"eventType\":\"USER_CREATED\"");
    }

    @Test
    void register_rolledBack_shouldLeaveNeitherUserNorEvent() {
        new TransactionTemplate(txManager).executeWithoutResult(status -> {
            userService.register("bob@test.io", "bob", "secret-1", null);
            status.setRollbackOnly();
        });

        assertThat(userRepo.count()).isZero();
        assertThat(outboxRepo.count()).isZero();
    }

    @Test
    void recordEvent_withoutTransaction_shouldFail() {
        assertThatThrownBy(() -> outboxService.recordEvent(1L, UserEventType.USER_UPDATED, "{}"))
                .isInstanceOf(IllegalTransactionStateException.class);
        assertThat(outboxRepo.count()).isZero();
    }

    @Test
    void updates_shouldCarryIncreasingVersionsAndChanges() throws Exception {
        UserAccount u = userService.register("carol@test.io", "carol", "secret-1", "Carol");
        userService.updateProfile(u.getId(), "Caroline", null);
        userService.updateOnlineStatus(u.getId(), true);

        List<UserEventOutbox> rows = outboxRepo.findBySubjectIdOrderByIdAsc(u.getId());
        assertThat(rows).extracting(UserEventOutbox::getEventType)
                .containsExactly(UserEventType.USER_CREATED, UserEventType.USER_UPDATED, UserEventType.USER_UPDATED);

        UserEvent created = objectMapper.readValue(rows.get(0).getPayload(), UserEvent.class);
        UserEvent renamed = objectMapper.readValue(rows.get(1).getPayload(), UserEvent.class);
        UserEvent online = objectMapper.readValue(rows.get(2).getPayload(), UserEvent.class);
        assertThat(renamed.version()).isGreaterThan(created.version());
        assertThat(online.version()).isGreaterThan(renamed.version());
        assertThat(renamed.data().displayName()).isEqualTo("Caroline");
        assertThat(((UserUpdated) renamed).changes()).containsExactly("displayName");
        assertThat(((UserUpdated) online).changes()).containsExactly("online", "lastSeen");
    }

    @Test
    void updateProfile_withoutChange_shouldNotWriteEvent() {
        UserAccount u = userService.register("dan@test.io", "dan", "secret-1", "Dan");

        userService.updateProfile(u.getId(), "Dan", null);

        assertThat(outboxRepo.findBySubjectIdOrderByIdAsc(u.getId())).hasSize(1);
    }

    @Test
    void deleteAccount_shouldRemoveUserAndWriteDeletedEvent() throws Exception {
        UserAccount u = userService.register("erin@test.io", "erin", "secret-1", null);

        userService.deleteAccount(u.getId());

        assertThat(userRepo.findById(u.getId())).isEmpty();
        List<UserEventOutbox> rows = outboxRepo.findBySubjectIdOrderByIdAsc(u.getId());
        assertThat(rows).hasSize(2);
        assertThat(objectMapper.readValue(rows.get(1).getPayload(), UserEvent.class)).isInstanceOf(UserDeleted.class);
    }
}
