package com.streamclient.kafka;

import com.streamclient.common.api.MessagingClientFactory;
import com.streamclient.common.api.MessagingConsumer;
import com.streamclient.common.api.MessagingProducer;
import jakarta.inject.Singleton;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Creates adapters backed by real Kafka clients
 */
@Singleton
public class KafkaClientFactory implements MessagingClientFactory {
    private static final Logger log = LoggerFactory.getLogger(KafkaClientFactory.class);

    @Override
    public MessagingConsumer createConsumer(Properties clientConfiguration) {
        log.info("Creating Kafka consumer: servers={}, group={}",
                clientConfiguration.get("bootstrap.servers"), clientConfiguration.get("group.id"));
        return new KafkaMessagingConsumer(new KafkaConsumer<byte[], byte[]>(clientConfiguration));
    }

    @Override
    public MessagingProducer createProducer(Properties clientConfiguration) {
        log.info("Creating Kafka producer: servers={}, clientId={}",
                clientConfiguration.get("bootstrap.servers"), clientConfiguration.get("client.id"));
        return new KafkaMessagingProducer(new KafkaProducer<byte[], byte[]>(clientConfiguration));
    }
}
