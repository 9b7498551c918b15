package com.streamclient.client.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.streamclient.common.configuration.ClientType;
import com.streamclient.common.configuration.ConfigurationResolver;
import com.streamclient.common.configuration.MapConfigurationSource;
import com.streamclient.common.configuration.ResolvedConfiguration;
import com.streamclient.common.exception.ConfigurationException;
import com.streamclient.common.exception.ErrorCode;
import com.streamclient.common.exception.ValidationException;
import com.streamclient.common.model.Message;
import com.streamclient.common.model.RawRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageFactoryTest {

    private ConfigurationResolver resolver;
    private MessageFactory factory;

    @BeforeEach
    void setUp() {
        resolver = new ConfigurationResolver(new MapConfigurationSource()
                .instance(ClientType.CONSUMER, "orders", "topics", "orders"));
        factory = new MessageFactory(List.of(new PlainDecoder(), new JsonDecoder()));
    }

    @Test
    void testPlainDecoder() throws Exception {
        Message message = factory.create(record("héllo"), resolver.resolve(ClientType.CONSUMER, "orders"));

        assertEquals("héllo", message.getValue());
        assertEquals("orders", message.getTopic());
    }

    @Test
    void testJsonDecoder() throws Exception {
        ResolvedConfiguration configuration = json();

        Message message = factory.create(record("{\"sku\":\"A-1\",\"qty\":3}"), configuration);

        JsonNode value = message.getValue(JsonNode.class);
        assertEquals("A-1", value.get("sku").asText());
        assertEquals(3, value.get("qty").asInt());
    }

    @Test
    void testMalformedJson() throws Exception {
        ResolvedConfiguration configuration = json();

        ValidationException ex = assertThrows(ValidationException.class,
                () -> factory.create(record("{\"sku\":"), configuration));

        assertEquals(ErrorCode.VALIDATION_DECODING_FAILED, ex.getErrorCode());
        assertEquals("json", ex.getContext().get("decoder"));
    }

    @Test
    void testBlankJson() throws Exception {
        ResolvedConfiguration configuration = json();

        assertThrows(ValidationException.class, () -> factory.create(record("   "), configuration));
    }

    @Test
    void testErrorRecord() throws Exception {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> factory.create(RawRecord.error("orders", 1, "unknown topic"),
                        resolver.resolve(ClientType.CONSUMER, "orders")));

        assertEquals(ErrorCode.VALIDATION_BROKER_ERROR_RECORD, ex.getErrorCode());
    }

    @Test
    void testUnknownDecoder() throws Exception {
        ResolvedConfiguration configuration = resolver.resolve(ClientType.CONSUMER, "orders", Map.of("decoder", "avro"));

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> factory.getDecoder(configuration));

        assertEquals(ErrorCode.CONFIGURATION_UNKNOWN_DECODER, ex.getErrorCode());
    }

    private ResolvedConfiguration json() throws Exception {
        return resolver.resolve(ClientType.CONSUMER, "orders", Map.of("decoder", "json"));
    }

    private static RawRecord record(String payload) {
        return RawRecord.of("orders", 0, 5L, null, payload.getBytes(StandardCharsets.UTF_8), 0L);
    }
}
