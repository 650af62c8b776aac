package org.relaychat.broker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.relaychat.events.chat.ChatEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Envoie sur Redis les événements de messagerie une fois la transaction validée.
 * Une écriture annulée ne produit donc jamais de push. Hors transaction (présence, saisie)
 * l'envoi est immédiat.
 */
@Component
@RequiredArgsConstructor
public class BrokerEventForwarder {

    private static final Logger log = LoggerFactory.getLogger(BrokerEventForwarder.class);

    private final EventPublisher publisher;
    private final ObjectMapper objectMapper;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void forward(ChatEvent event) {
        String channel = event.channel().channel();
        try {
            publisher.publish(channel, objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Événement {} non sérialisable", channel, e);
        } catch (RuntimeException e) {
            // l'écriture est déjà validée : on journalise, l'appel REST reste un succès
            log.warn("Publication {} impossible: {}", channel, e.getMessage());
        }
    }
}
