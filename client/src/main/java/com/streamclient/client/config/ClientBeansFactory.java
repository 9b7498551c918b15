package com.streamclient.client.config;

import com.streamclient.common.configuration.ConfigurationResolver;
import com.streamclient.common.configuration.ConfigurationSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.core.value.PropertyResolver;
import jakarta.inject.Singleton;

/**
 * Wires the framework-free configuration classes of the common module into the application context.
 */
@Factory
public class ClientBeansFactory {

    /** Options read from application.yml messaging.* properties */
    @Singleton
    public ConfigurationSource configurationSource(PropertyResolver propertyResolver) {
        return new PropertyConfigurationSource(propertyResolver);
    }

    /** Shared resolver, so resolved configurations are memoized once per application */
    @Singleton
    public ConfigurationResolver configurationResolver(ConfigurationSource configurationSource) {
        return new ConfigurationResolver(configurationSource);
    }

    /** In-memory registry for applications that do not bring their own */
    @Singleton
    @Requires(missingBeans = MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
