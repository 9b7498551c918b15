package com.streamclient.common.configuration;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void testFromConfiguration() throws Exception {
        MapConfigurationSource source = new MapConfigurationSource()
                .instance(ClientType.CONSUMER, "orders", "topics", "orders");
        ResolvedConfiguration configuration = new ConfigurationResolver(source).resolve(ClientType.CONSUMER, "orders",
                Map.of("max-retries", 2, "retry-delay", 100, "max-retry-delay", 500, "retry-multiplier", 3));

        RetryPolicy policy = RetryPolicy.from(configuration);

        assertEquals(100L, policy.getInitialDelayMs());
        assertEquals(500L, policy.getMaxDelayMs());
        assertEquals(3.0, policy.getMultiplier());
        assertEquals(2, policy.getMaxRetries());
    }

    @Test
    void testEqualDelaysAllowed() throws Exception {
        MapConfigurationSource source = new MapConfigurationSource()
                .instance(ClientType.CONSUMER, "orders", "topics", "orders")
                .instance(ClientType.CONSUMER, "orders", "retry-delay", 300)
                .instance(ClientType.CONSUMER, "orders", "max-retry-delay", 300)
                .instance(ClientType.CONSUMER, "orders", "retry-multiplier", 1);

        RetryPolicy policy = RetryPolicy.from(new ConfigurationResolver(source).resolve(ClientType.CONSUMER, "orders"));

        assertEquals(300L, policy.getMaxDelayMs());
        assertEquals(1.0, policy.getMultiplier());
    }
}
