package com.streamclient.client.producer;

import com.streamclient.client.config.BlacklistConfiguration;
import com.streamclient.common.api.MessagingClientFactory;
import com.streamclient.common.api.MessagingConsumer;
import com.streamclient.common.api.MessagingProducer;
import com.streamclient.common.api.ProducerHandler;
import com.streamclient.common.configuration.ClientType;
import com.streamclient.common.configuration.ConfigurationResolver;
import com.streamclient.common.configuration.MapConfigurationSource;
import com.streamclient.common.exception.ErrorCode;
import com.streamclient.common.exception.ProducerException;
import com.streamclient.common.model.ProducerMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ProducerClientTest {

    private Map<String, FakeMessagingProducer> producers;
    private ProducerResourceCache cache;

    @BeforeEach
    void setUp() {
        MapConfigurationSource source = new MapConfigurationSource()
                .group(ClientType.PRODUCER, "flush-timeout", 2500)
                .instance(ClientType.PRODUCER, "invoices", "topics", "invoices,invoices-audit")
                .instance(ClientType.PRODUCER, "shipments", "topics", "shipments")
                .instance(ClientType.PRODUCER, "shipments", "producer-partition", 3);
        producers = new HashMap<>();

        cache = new ProducerResourceCache(
                new ConfigurationResolver(source),
                configuration -> {
                    Properties properties = new Properties();
                    properties.put("client.id", configuration.getName());
                    return properties;
                },
                new MessagingClientFactory() {
                    @Override
                    public MessagingConsumer createConsumer(Properties clientConfiguration) {
                        throw new UnsupportedOperationException();
                    }

                    @Override
                    public MessagingProducer createProducer(Properties clientConfiguration) {
                        FakeMessagingProducer producer = new FakeMessagingProducer();
                        producers.put(clientConfiguration.getProperty("client.id"), producer);
                        return producer;
                    }
                },
                new ConfiguredBlacklistPolicy(new BlacklistConfiguration()));
    }

    @Test
    void testPublishesToEveryTopicAndFlushes() throws Exception {
        ProducerClient client = new ProducerClient(List.of(), cache);

        client.produce("invoices", ProducerMessage.of("{\"id\":1}", "inv-1"));

        FakeMessagingProducer producer = producers.get("invoices");
        assertEquals(List.of("invoices/-1/inv-1/{\"id\":1}", "invoices-audit/-1/inv-1/{\"id\":1}"),
                producer.getPublished());
        assertEquals(List.of(2500L), producer.getFlushes());
    }

    @Test
    void testConfiguredPartition() throws Exception {
        ProducerClient client = new ProducerClient(List.of(), cache);

        client.produce("shipments", ProducerMessage.of("parcel", null));

        assertEquals(List.of("shipments/3/-/parcel"), producers.get("shipments").getPublished());
    }

    @Test
    void testProduceThroughSupportingHandlers() throws Exception {
        ProducerClient client = new ProducerClient(List.of(
                new StringHandler("invoices", "invoice:"),
                new StringHandler("shipments", "shipment:")), cache);

        client.produce("shipment:42");

        assertEquals(List.of("shipments/3/-/shipment:42"), producers.get("shipments").getPublished());
        assertNull(producers.get("invoices"));
    }

    @Test
    void testNoSupportingHandler() {
        ProducerClient client = new ProducerClient(List.of(new StringHandler("invoices", "invoice:")), cache);

        ProducerException ex = assertThrows(ProducerException.class, () -> client.produce(42));

        assertEquals(ErrorCode.PRODUCER_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    void testFlushFailure() throws Exception {
        ProducerClient client = new ProducerClient(List.of(), cache);
        client.produce("invoices", ProducerMessage.of("first", null));
        producers.get("invoices").setFlushResult(false);

        ProducerException ex = assertThrows(ProducerException.class,
                () -> client.produce("invoices", ProducerMessage.of("second", null)));

        assertEquals(ErrorCode.PRODUCER_FLUSH_FAILED, ex.getErrorCode());
        assertEquals("invoices", ex.getContext().get("producer"));
        assertEquals(1, producers.size());
    }

    private static class StringHandler implements ProducerHandler {
        private final String name;
        private final String prefix;

        StringHandler(String name, String prefix) {
            this.name = name;
            this.prefix = prefix;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean supports(Object data) {
            return data instanceof String && ((String) data).startsWith(prefix);
        }

        @Override
        public ProducerMessage produce(Object data) {
            return ProducerMessage.of((String) data, null);
        }
    }
}
