package com.streamclient.kafka;

import com.streamclient.common.api.ClientConfigurationFactory;
import com.streamclient.common.configuration.ClientType;
import com.streamclient.common.configuration.ConfigurationOption;
import com.streamclient.common.configuration.ResolvedConfiguration;
import jakarta.inject.Singleton;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import java.util.Properties;

/**
 * Builds kafka-clients configuration from a resolved consumer or producer configuration
 */
@Singleton
public class KafkaConfigurationFactory implements ClientConfigurationFactory {

    @Override
    public Properties create(ResolvedConfiguration configuration) {
        Properties properties = new Properties();
        properties.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
                String.join(",", configuration.getList(ConfigurationOption.BROKERS)));

        if (configuration.getType() == ClientType.CONSUMER) {
            properties.put(ConsumerConfig.CLIENT_ID_CONFIG, "consumer-" + configuration.getName());
            properties.put(ConsumerConfig.GROUP_ID_CONFIG, configuration.getString(ConfigurationOption.GROUP_ID));
            properties.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG,
                    String.valueOf(configuration.getBoolean(ConfigurationOption.ENABLE_AUTO_COMMIT)));
            properties.put(ConsumerConfig.AUTO_COMMIT_INTERVAL_MS_CONFIG,
                    String.valueOf(configuration.getLong(ConfigurationOption.AUTO_COMMIT_INTERVAL_MS)));
            properties.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG,
                    configuration.getString(ConfigurationOption.AUTO_OFFSET_RESET));
            // one record per poll keeps the position from running ahead of the record being handled
            properties.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "1");
            properties.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
            properties.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        } else {
            properties.put(ProducerConfig.CLIENT_ID_CONFIG, "producer-" + configuration.getName());
            properties.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
            properties.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        }
        return properties;
    }
}
