package com.streamclient.kafka;

import com.streamclient.common.model.RawRecord;
import com.streamclient.common.model.RecordStatus;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KafkaMessagingConsumerTest {

    private static final String TOPIC = "orders";

    private MockConsumer<byte[], byte[]> mockConsumer;
    private KafkaMessagingConsumer consumer;
    private TopicPartition partition;

    @BeforeEach
    void setUp() throws Exception {
        mockConsumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer = new KafkaMessagingConsumer(mockConsumer);
        partition = new TopicPartition(TOPIC, 0);

        consumer.subscribe(List.of(TOPIC));
        mockConsumer.rebalance(List.of(partition));
        mockConsumer.updateBeginningOffsets(Map.of(partition, 0L));
    }

    @Test
    void testEmptyPollIsReportedAsTimedOut() throws Exception {
        RawRecord record = consumer.poll(10);

        assertNotNull(record);
        assertEquals(RecordStatus.TIMED_OUT, record.getStatus());
        assertFalse(record.hasPayload());
    }

    @Test
    void testRecordsAreHandedOutOneAtATime() throws Exception {
        mockConsumer.addRecord(record(0L, "k0", "first"));
        mockConsumer.addRecord(record(1L, "k1", "second"));

        RawRecord first = consumer.poll(10);
        assertEquals(RecordStatus.NO_ERROR, first.getStatus());
        assertEquals(0L, first.getOffset());
        assertEquals("first", new String(first.getPayload(), StandardCharsets.UTF_8));
        assertEquals("k0", new String(first.getKey(), StandardCharsets.UTF_8));
        assertEquals(1, consumer.getBufferedCount());

        RawRecord second = consumer.poll(10);
        assertEquals(1L, second.getOffset());
        assertEquals(TOPIC, second.getTopic());
        assertEquals(0, second.getPartition());
        assertEquals(0, consumer.getBufferedCount());

        assertEquals(RecordStatus.TIMED_OUT, consumer.poll(10).getStatus());
    }

    @Test
    void testCommitStoresNextOffset() throws Exception {
        mockConsumer.addRecord(record(4L, "k", "payload"));

        RawRecord record = consumer.poll(10);
        consumer.commit(record);

        Map<TopicPartition, OffsetAndMetadata> committed = mockConsumer.committed(Set.of(partition));
        assertEquals(5L, committed.get(partition).offset());
    }

    @Test
    void testCloseClosesUnderlyingConsumer() {
        consumer.close();

        assertTrue(mockConsumer.closed());
    }

    @Test
    void testCloseRewindsToFirstRecordNotHandedOut() throws Exception {
        Map<TopicPartition, Long> positionAtClose = new HashMap<>();
        MockConsumer<byte[], byte[]> closingConsumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST) {
            @Override
            public synchronized void close() {
                positionAtClose.put(partition, position(partition));
                super.close();
            }
        };
        KafkaMessagingConsumer adapter = new KafkaMessagingConsumer(closingConsumer);
        adapter.subscribe(List.of(TOPIC));
        closingConsumer.rebalance(List.of(partition));
        closingConsumer.updateBeginningOffsets(Map.of(partition, 0L));
        closingConsumer.addRecord(record(0L, "k0", "first"));
        closingConsumer.addRecord(record(1L, "k1", "second"));
        closingConsumer.addRecord(record(2L, "k2", "third"));

        RawRecord handedOut = adapter.poll(10);
        assertEquals(0L, handedOut.getOffset());
        assertEquals(2, adapter.getBufferedCount());
        assertEquals(3L, closingConsumer.position(partition));

        adapter.close();

        assertEquals(1L, positionAtClose.get(partition));
        assertEquals(0, adapter.getBufferedCount());
        assertTrue(closingConsumer.closed());
    }

    private ConsumerRecord<byte[], byte[]> record(long offset, String key, String value) {
        return new ConsumerRecord<>(TOPIC, 0, offset,
                key.getBytes(StandardCharsets.UTF_8), value.getBytes(StandardCharsets.UTF_8));
    }
}
