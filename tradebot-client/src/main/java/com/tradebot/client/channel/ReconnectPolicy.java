package com.tradebot.client.channel;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded, fixed-delay reconnect budget.
 */
public class ReconnectPolicy {

    private final int maxAttempts;
    private final long delayMs;
    private final AtomicInteger attempt = new AtomicInteger();

    public ReconnectPolicy(int maxAttempts, long delayMs) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.delayMs = delayMs;
    }

    public boolean hasAttemptsLeft() {
        return attempt.get() < maxAttempts;
    }

    /**
     * Consume one attempt.
     *
     * @return the attempt number just consumed, starting at 1
     */
    public int nextAttempt() {
        return attempt.incrementAndGet();
    }

    public void reset() {
        attempt.set(0);
    }

    public int getAttempt() {
        return attempt.get();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getDelayMs() {
        return delayMs;
    }
}
