package org.relaychat.service.identity;

/**
 * Bilan d'un passage du relais.
 *
 * @param skipped vrai si un autre passage était déjà en cours
 */
public record RelayCycle(int fetched, int published, int failed, int deadLettered, boolean skipped) {

    static RelayCycle alreadyRunning() {
        return new RelayCycle(0, 0, 0, 0, true);
    }
}
