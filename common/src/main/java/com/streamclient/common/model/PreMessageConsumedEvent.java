package com.streamclient.common.model;

public class PreMessageConsumedEvent extends ConsumptionEvent {
    public static final String NAME = "stream_client.pre_message_consumed";

    public PreMessageConsumedEvent(String consumerName, ConsumptionMetrics metrics) {
        super(consumerName, metrics);
    }

    @Override
    public String getBaseEventName() {
        return NAME;
    }
}
