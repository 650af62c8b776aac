package org.relaychat.controller;

import java.security.Principal;

/** Le nom du principal est l'identifiant de l'utilisateur (voir UserDetailsServiceImpl). */
final class Principals {

    private Principals() {
    }

    static Long userId(Principal principal) {
        if (principal == null) {
            throw new IllegalStateException("Requête non authentifiée");
        }
        return Long.valueOf(principal.getName());
    }
}
