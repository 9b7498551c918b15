package com.streamclient.client.config;

import com.streamclient.common.configuration.ClientType;
import com.streamclient.common.configuration.ConfigurationOption;
import com.streamclient.common.configuration.ConfigurationSource;
import io.micronaut.core.value.PropertyResolver;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads client options from the application properties:
 * <pre>
 * messaging.&lt;option&gt;                                      global
 * messaging.consumers.&lt;option&gt;                            all consumers
 * messaging.consumers.instances.&lt;name&gt;.&lt;option&gt;          one consumer
 * </pre>
 * and the same for producers under messaging.producers.
 */
public class PropertyConfigurationSource implements ConfigurationSource {
    static final String PREFIX = "messaging";

    private final PropertyResolver properties;

    public PropertyConfigurationSource(PropertyResolver properties) {
        this.properties = properties;
    }

    @Override
    public Map<String, Object> getGlobal() {
        return read(PREFIX + ".");
    }

    @Override
    public Map<String, Object> getGroup(ClientType type) {
        return read(PREFIX + "." + type.getSection() + ".");
    }

    @Override
    public Map<String, Object> getInstance(ClientType type, String name) {
        return read(PREFIX + "." + type.getSection() + ".instances." + name + ".");
    }

    private Map<String, Object> read(String prefix) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ConfigurationOption option : ConfigurationOption.values()) {
            String key = prefix + option.getOptionName();
            // raw value, converted to the option type by the resolver
            properties.getProperty(key, Object.class)
                    .ifPresent(value -> values.put(option.getOptionName(), value));
        }
        return values;
    }
}
