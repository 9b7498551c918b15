package com.streamclient.common.model;

public class PostMessageConsumedEvent extends ConsumptionEvent {
    public static final String NAME = "stream_client.post_message_consumed";

    public PostMessageConsumedEvent(String consumerName, ConsumptionMetrics metrics) {
        super(consumerName, metrics);
    }

    @Override
    public String getBaseEventName() {
        return NAME;
    }
}
