package com.streamclient.common.model;

/**
 * Lifecycle event emitted by the consumption loop around each poll cycle
 */
public abstract class ConsumptionEvent {
    private final String consumerName;
    private final ConsumptionMetrics metrics;

    protected ConsumptionEvent(String consumerName, ConsumptionMetrics metrics) {
        this.consumerName = consumerName;
        this.metrics = metrics;
    }

    public String getConsumerName() {
        return consumerName;
    }

    public ConsumptionMetrics getMetrics() {
        return metrics;
    }

    public long getConsumedMessages() {
        return metrics.getConsumedMessages();
    }

    public double getConsumptionTimeMs() {
        return metrics.getConsumptionTimeMs();
    }

    /**
     * Event name scoped to one consumer, e.g. "stream_client.pre_message_consumed.orders"
     */
    public String getEventName() {
        return getBaseEventName() + "." + consumerName;
    }

    public abstract String getBaseEventName();
}
