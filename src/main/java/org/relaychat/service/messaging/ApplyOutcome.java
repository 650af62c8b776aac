package org.relaychat.service.messaging;

/**
 * Effet d'un événement d'identité sur la réplique.
 */
public enum ApplyOutcome {
    APPLIED,
    /** version plus ancienne que celle déjà appliquée */
    STALE,
    /** profil supprimé : plus aucun événement ne le modifie */
    TOMBSTONED
}
