package org.relaychat.events.chat;

/**
 * À qui la passerelle pousse un événement reçu du broker.
 */
public enum RoutingPolicy {
    /** toutes les sessions de la salle, auteur compris */
    ROOM_ALL,
    /** la salle, sauf toutes les sessions de l'utilisateur à l'origine de l'événement */
    ROOM_EXCLUDING_ACTOR,
    /** toutes les sessions d'un utilisateur cible */
    UNICAST_TARGET,
    /** toutes les sessions connectées */
    GLOBAL
}
