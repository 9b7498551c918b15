package com.streamclient.kafka;

import com.streamclient.common.api.DestinationHandle;
import com.streamclient.common.api.MessagingProducer;
import com.streamclient.common.exception.ProducerException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Publishes through a Kafka producer and tracks sends until they are flushed
 */
public class KafkaMessagingProducer implements MessagingProducer {
    private static final Logger log = LoggerFactory.getLogger(KafkaMessagingProducer.class);

    private final Producer<byte[], byte[]> producer;
    private final List<Future<RecordMetadata>> pending = new ArrayList<>();

    public KafkaMessagingProducer(Producer<byte[], byte[]> producer) {
        this.producer = producer;
    }

    @Override
    public DestinationHandle newDestinationHandle(String topic) {
        return new KafkaDestinationHandle(topic, this);
    }

    @Override
    public synchronized void publish(DestinationHandle destination, int partition, byte[] payload, byte[] key)
            throws ProducerException {
        if (!(destination instanceof KafkaDestinationHandle)
                || !((KafkaDestinationHandle) destination).isOwnedBy(this)) {
            throw new IllegalArgumentException("Destination " + destination + " was not created by this producer");
        }

        String topic = destination.getTopic();
        ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(
                topic, partition == PARTITION_UNASSIGNED ? null : partition, key, payload);
        try {
            pending.add(producer.send(record, (metadata, exception) -> {
                if (exception != null) {
                    log.error("Delivery to topic {} failed", topic, exception);
                } else {
                    log.debug("Delivered to {}-{} at offset {}", metadata.topic(), metadata.partition(), metadata.offset());
                }
            }));
        } catch (KafkaException e) {
            throw ProducerException.publishFailed(topic, e);
        }
    }

    @Override
    public synchronized boolean flush(long timeoutMs) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        boolean delivered = true;

        Iterator<Future<RecordMetadata>> iterator = pending.iterator();
        while (iterator.hasNext()) {
            Future<RecordMetadata> future = iterator.next();
            long remaining = deadline - System.nanoTime();
            try {
                future.get(Math.max(remaining, 0L), TimeUnit.NANOSECONDS);
                iterator.remove();
            } catch (TimeoutException e) {
                log.warn("Flush timed out after {} ms with {} message(s) outstanding", timeoutMs, pending.size());
                return false;
            } catch (ExecutionException e) {
                iterator.remove();
                delivered = false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return delivered;
    }

    /**
     * Sends not yet confirmed by a flush
     */
    synchronized int getPendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        try {
            producer.close();
        } catch (KafkaException e) {
            log.warn("Error closing Kafka producer", e);
        }
    }
}
