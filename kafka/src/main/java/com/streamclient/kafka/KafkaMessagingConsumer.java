package com.streamclient.kafka;

import com.streamclient.common.api.MessagingConsumer;
import com.streamclient.common.exception.ConsumerException;
import com.streamclient.common.model.RawRecord;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands out the records of a Kafka consumer one at a time.
 *
 * The client is configured for single-record polls. Should a poll still return more, the extra
 * records are buffered and the broker is only polled again once they have been handed out;
 * on close the position is moved back to the first record not handed out, so the offset
 * committed on close never skips them. An empty broker poll is reported as a TIMED_OUT record.
 * Not thread-safe, like the underlying consumer.
 */
public class KafkaMessagingConsumer implements MessagingConsumer {
    private static final Logger log = LoggerFactory.getLogger(KafkaMessagingConsumer.class);

    private final Consumer<byte[], byte[]> consumer;
    private final Deque<ConsumerRecord<byte[], byte[]>> buffer = new ArrayDeque<>();

    public KafkaMessagingConsumer(Consumer<byte[], byte[]> consumer) {
        this.consumer = consumer;
    }

    @Override
    public void subscribe(List<String> topics) throws ConsumerException {
        try {
            consumer.subscribe(topics);
            log.info("Subscribed to topics: {}", String.join(",", topics));
        } catch (KafkaException | IllegalArgumentException | IllegalStateException e) {
            throw ConsumerException.subscriptionFailed(String.join(",", topics), e);
        }
    }

    @Override
    public RawRecord poll(long timeoutMs) throws ConsumerException {
        if (buffer.isEmpty()) {
            try {
                ConsumerRecords<byte[], byte[]> records = consumer.poll(Duration.ofMillis(timeoutMs));
                for (ConsumerRecord<byte[], byte[]> record : records) {
                    buffer.add(record);
                }
            } catch (KafkaException | IllegalStateException e) {
                throw ConsumerException.pollFailed(e);
            }
        }

        ConsumerRecord<byte[], byte[]> next = buffer.poll();
        if (next == null) {
            return RawRecord.timedOut();
        }
        return RawRecord.of(next.topic(), next.partition(), next.offset(), next.key(), next.value(), next.timestamp());
    }

    @Override
    public void commit(RawRecord record) throws ConsumerException {
        TopicPartition partition = new TopicPartition(record.getTopic(), record.getPartition());
        try {
            consumer.commitSync(Map.of(partition, new OffsetAndMetadata(record.getOffset() + 1)));
            log.debug("Committed offset {} for {}", record.getOffset() + 1, partition);
        } catch (KafkaException e) {
            throw ConsumerException.offsetCommitFailed(record.getTopic(), record.getPartition(), record.getOffset(), e);
        }
    }

    /**
     * Number of records fetched from the broker but not handed out yet
     */
    int getBufferedCount() {
        return buffer.size();
    }

    /**
     * Seek every partition with buffered records back to the first of them
     */
    private void rewindBuffered() {
        Map<TopicPartition, Long> firstOffsets = new LinkedHashMap<>();
        for (ConsumerRecord<byte[], byte[]> record : buffer) {
            firstOffsets.putIfAbsent(new TopicPartition(record.topic(), record.partition()), record.offset());
        }
        for (Map.Entry<TopicPartition, Long> entry : firstOffsets.entrySet()) {
            try {
                consumer.seek(entry.getKey(), entry.getValue());
                log.debug("Rewound {} to unhandled offset {}", entry.getKey(), entry.getValue());
            } catch (KafkaException | IllegalStateException e) {
                log.warn("Could not rewind {} to offset {}, buffered records may be skipped",
                        entry.getKey(), entry.getValue(), e);
            }
        }
        buffer.clear();
    }

    @Override
    public void close() {
        rewindBuffered();
        try {
            consumer.close();
        } catch (KafkaException e) {
            log.warn("Error closing Kafka consumer", e);
        }
    }
}
