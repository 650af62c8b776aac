package org.relaychat.service.support;

/**
 * Calcule l'attente avant une nouvelle tentative.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param attempts nombre de tentatives déjà faites (à partir de 1)
     * @return délai en millisecondes, jamais négatif
     */
    long computeDelayMs(int attempts);

    static RetryPolicy none() {
        return attempts -> 0L;
    }
}
