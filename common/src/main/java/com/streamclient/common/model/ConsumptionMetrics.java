package com.streamclient.common.model;

/**
 * Snapshot of a consumer's running counters, passed to lifecycle events.
 */
public final class ConsumptionMetrics {
    private final long consumedMessages;
    private final double consumptionTimeMs;

    public ConsumptionMetrics(long consumedMessages, double consumptionTimeMs) {
        this.consumedMessages = consumedMessages;
        this.consumptionTimeMs = consumptionTimeMs;
    }

    public long getConsumedMessages() {
        return consumedMessages;
    }

    /**
     * Duration of the last poll cycle in milliseconds
     */
    public double getConsumptionTimeMs() {
        return consumptionTimeMs;
    }

    @Override
    public String toString() {
        return "ConsumptionMetrics{consumedMessages=" + consumedMessages +
               ", consumptionTimeMs=" + consumptionTimeMs + '}';
    }
}
