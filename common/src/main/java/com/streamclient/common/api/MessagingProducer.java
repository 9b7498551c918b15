package com.streamclient.common.api;

import com.streamclient.common.exception.ProducerException;

/**
 * Producer side of the messaging client adapter.
 * Implementations: KafkaMessagingProducer
 */
public interface MessagingProducer extends AutoCloseable {

    /**
     * Let the client pick the partition
     */
    int PARTITION_UNASSIGNED = -1;

    /**
     * Create a handle for publishing to one topic
     * @param topic Topic name
     */
    DestinationHandle newDestinationHandle(String topic);

    default void publish(DestinationHandle destination, byte[] payload, byte[] key) throws ProducerException {
        publish(destination, PARTITION_UNASSIGNED, payload, key);
    }

    /**
     * Publish one message
     * @param destination Handle created by this producer
     * @param partition Target partition, or {@link #PARTITION_UNASSIGNED}
     * @param payload Message payload
     * @param key Message key, may be null
     */
    void publish(DestinationHandle destination, int partition, byte[] payload, byte[] key) throws ProducerException;

    /**
     * Wait for outstanding messages to be delivered
     * @param timeoutMs Timeout in milliseconds
     * @return true if every outstanding message was delivered in time
     */
    boolean flush(long timeoutMs);

    @Override
    void close();
}
