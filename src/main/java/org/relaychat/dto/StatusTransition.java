package org.relaychat.dto;

import org.relaychat.model.MessageStatus;

/**
 * Résultat d'une demande de transition de statut pour un destinataire.
 */
public record StatusTransition(Long messageId, Long userId, MessageStatus previous, MessageStatus current,
                               Outcome outcome) {

    public enum Outcome {
        APPLIED,
        ALREADY_AT_OR_BEYOND
    }

    public boolean applied() {
        return outcome == Outcome.APPLIED;
    }
}
