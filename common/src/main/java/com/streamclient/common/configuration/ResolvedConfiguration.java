package com.streamclient.common.configuration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fully defaulted and validated options for one named consumer or producer.
 * Immutable once built by the {@link ConfigurationResolver}.
 */
public final class ResolvedConfiguration {
    private final ClientType type;
    private final String name;
    private final Map<String, Object> values;

    ResolvedConfiguration(ClientType type, String name, Map<String, Object> values) {
        this.type = type;
        this.name = name;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public ClientType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public Object getValue(ConfigurationOption option) {
        if (!option.appliesTo(type)) {
            throw new IllegalArgumentException(
                    "Option " + option.getOptionName() + " does not apply to " + type);
        }
        return values.get(option.getOptionName());
    }

    public String getString(ConfigurationOption option) {
        return (String) getValue(option);
    }

    public int getInt(ConfigurationOption option) {
        return (Integer) getValue(option);
    }

    public long getLong(ConfigurationOption option) {
        return (Long) getValue(option);
    }

    public double getDouble(ConfigurationOption option) {
        return (Double) getValue(option);
    }

    public boolean getBoolean(ConfigurationOption option) {
        return (Boolean) getValue(option);
    }

    @SuppressWarnings("unchecked")
    public List<String> getList(ConfigurationOption option) {
        return (List<String>) getValue(option);
    }

    @Override
    public String toString() {
        return "ResolvedConfiguration{" + type + " '" + name + "' " + values + '}';
    }
}
