package org.relaychat.service.messaging;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.junit.jupiter.api.AfterEach;
import org.relaychat.dto.ConversationSummary;
import org.relaychat.dto.MessageView;
import org.relaychat.kv.InMemoryKvClient;
import org.relaychat.model.ConversationKind;
import org.relaychat.model.UserProfile;
import org.relaychat.repo.UserProfileRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Outils communs aux tests de messagerie : profils de la réplique, conversations, nettoyage.
 */
abstract class MessagingTestSupport {

    @Autowired
    protected ConversationService conversationService;

    @Autowired
    protected MessageService messageService;

    @Autowired
    protected MessageStatusService statusService;

    @Autowired
    protected UserProfileRepository profileRepo;

    @Autowired
    protected InMemoryKvClient kv;

    @Autowired
    protected MessagingTestConfig.RecordedEvents recorded;

    @Autowired
    private PlatformTransactionManager txManager;

    @PersistenceContext
    private EntityManager em;

    @AfterEach
    void wipe() {
        new TransactionTemplate(txManager).executeWithoutResult(status -> {
            for (String entity : List.of("MessageStatusEvent", "Message", "Participant", "Conversation", "UserProfile")) {
                em.createQuery("delete from " + entity).executeUpdate();
            }
        });
        kv.del(kv.scan("", Integer.MAX_VALUE));
        recorded.clear();
    }

    protected void profile(Long userId, String username) {
        profileRepo.save(UserProfile.builder()
                .userId(userId)
                .username(username)
                .displayName(username)
                .sourceVersion(0)
                .build());
    }

    protected Long direct(Long a, Long b) {
        return conversationService.createConversation(a, ConversationKind.DIRECT, null, null, List.of(b)).getId();
    }

    protected Long group(Long creator, String name, Long... others) {
        ConversationSummary s = conversationService.createConversation(creator, ConversationKind.GROUP, name, null, List.of(others));
        return s.getId();
    }

    protected Long send(Long sender, Long conversationId, String text) {
        MessageView v = messageService.sendMessage(sender, conversationId, text, null, null);
        return v.id();
    }
}
