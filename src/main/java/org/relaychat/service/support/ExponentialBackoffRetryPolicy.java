package org.relaychat.service.support;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff exponentiel avec gigue : {@code base * 2^(attempt-1)}, plafonné à {@code maxDelayMs},
 * multiplié par un facteur aléatoire dans [0.5, 1.5).
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs doit être > 0, reçu : " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs doit être >= baseDelayMs, reçu : " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempts) {
        if (attempts <= 0) {
            return 0L;
        }
        long expDelay;
        if (attempts >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempts - 1);
            // pas de dépassement de capacité : on plafonne avant de multiplier
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
    }
}
