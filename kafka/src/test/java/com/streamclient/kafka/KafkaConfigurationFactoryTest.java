package com.streamclient.kafka;

import com.streamclient.common.configuration.ClientType;
import com.streamclient.common.configuration.ConfigurationResolver;
import com.streamclient.common.configuration.MapConfigurationSource;
import com.streamclient.common.configuration.ResolvedConfiguration;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class KafkaConfigurationFactoryTest {

    private final KafkaConfigurationFactory factory = new KafkaConfigurationFactory();

    @Test
    void testConsumerProperties() throws Exception {
        MapConfigurationSource source = new MapConfigurationSource()
                .global("brokers", List.of("kafka-1:9092", "kafka-2:9092"))
                .instance(ClientType.CONSUMER, "orders", "topics", List.of("orders"))
                .instance(ClientType.CONSUMER, "orders", "group-id", "billing")
                .instance(ClientType.CONSUMER, "orders", "enable-auto-commit", "false");
        ResolvedConfiguration configuration = new ConfigurationResolver(source).resolve(ClientType.CONSUMER, "orders");

        Properties properties = factory.create(configuration);

        assertEquals("kafka-1:9092,kafka-2:9092", properties.get("bootstrap.servers"));
        assertEquals("billing", properties.get("group.id"));
        assertEquals("false", properties.get("enable.auto.commit"));
        assertEquals("50", properties.get("auto.commit.interval.ms"));
        assertEquals("earliest", properties.get("auto.offset.reset"));
        assertEquals("consumer-orders", properties.get("client.id"));
        assertEquals("1", properties.get("max.poll.records"));
        assertEquals(ByteArrayDeserializer.class.getName(), properties.get("value.deserializer"));
    }

    @Test
    void testProducerProperties() throws Exception {
        MapConfigurationSource source = new MapConfigurationSource()
                .instance(ClientType.PRODUCER, "invoices", "topics", "invoices");
        ResolvedConfiguration configuration = new ConfigurationResolver(source).resolve(ClientType.PRODUCER, "invoices");

        Properties properties = factory.create(configuration);

        assertEquals("127.0.0.1:9092", properties.get("bootstrap.servers"));
        assertEquals("producer-invoices", properties.get("client.id"));
        assertEquals(ByteArraySerializer.class.getName(), properties.get("value.serializer"));
        assertNull(properties.get("group.id"));
        assertNull(properties.get("max.poll.records"));
    }
}
