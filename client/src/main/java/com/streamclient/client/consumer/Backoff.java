package com.streamclient.client.consumer;

import com.streamclient.common.configuration.RetryPolicy;

/**
 * Working delay of the active retry sequence.
 * Grows by the multiplier on every retry, clamped to the maximum delay.
 */
public class Backoff {
    private final RetryPolicy policy;
    private long currentDelayMs;

    public Backoff(RetryPolicy policy) {
        this.policy = policy;
        this.currentDelayMs = policy.getInitialDelayMs();
    }

    /**
     * Grow the working delay and return it
     */
    public long next() {
        double grown = currentDelayMs * policy.getMultiplier();
        currentDelayMs = grown >= policy.getMaxDelayMs() ? policy.getMaxDelayMs() : (long) grown;
        return currentDelayMs;
    }

    /**
     * Back to the initial delay, called once a message's retry sequence is over
     */
    public void reset() {
        currentDelayMs = policy.getInitialDelayMs();
    }

    public long getCurrentDelayMs() {
        return currentDelayMs;
    }
}
