package com.streamclient.common.api;

import com.streamclient.common.exception.ConsumerException;
import com.streamclient.common.model.RawRecord;

import java.util.List;

/**
 * Consumer side of the messaging client adapter.
 * Implementations: KafkaMessagingConsumer
 */
public interface MessagingConsumer extends AutoCloseable {

    /**
     * Subscribe to the given topics
     * @param topics Topic names
     */
    void subscribe(List<String> topics) throws ConsumerException;

    /**
     * Wait up to the timeout for the next record
     * @param timeoutMs Timeout in milliseconds
     * @return The next record, a record carrying an empty-poll status, or null
     */
    RawRecord poll(long timeoutMs) throws ConsumerException;

    /**
     * Commit the offset of a record so it is not delivered again
     * @param record Record to commit
     */
    void commit(RawRecord record) throws ConsumerException;

    @Override
    void close();
}
