package com.streamclient.kafka;

import com.streamclient.common.api.DestinationHandle;

/**
 * Topic handle owned by one {@link KafkaMessagingProducer}
 */
final class KafkaDestinationHandle implements DestinationHandle {
    private final String topic;
    private final KafkaMessagingProducer owner;

    KafkaDestinationHandle(String topic, KafkaMessagingProducer owner) {
        this.topic = topic;
        this.owner = owner;
    }

    @Override
    public String getTopic() {
        return topic;
    }

    boolean isOwnedBy(KafkaMessagingProducer producer) {
        return owner == producer;
    }

    @Override
    public String toString() {
        return "KafkaDestinationHandle{topic='" + topic + "'}";
    }
}
