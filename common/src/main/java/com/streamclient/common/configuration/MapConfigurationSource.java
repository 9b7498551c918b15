package com.streamclient.common.configuration;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * In-memory configuration source
 */
public class MapConfigurationSource implements ConfigurationSource {
    private final Map<String, Object> global = new HashMap<>();
    private final Map<ClientType, Map<String, Object>> groups = new EnumMap<>(ClientType.class);
    private final Map<ClientType, Map<String, Map<String, Object>>> instances = new EnumMap<>(ClientType.class);

    public MapConfigurationSource global(String option, Object value) {
        global.put(option, value);
        return this;
    }

    public MapConfigurationSource group(ClientType type, String option, Object value) {
        groups.computeIfAbsent(type, t -> new HashMap<>()).put(option, value);
        return this;
    }

    public MapConfigurationSource instance(ClientType type, String name, String option, Object value) {
        instances.computeIfAbsent(type, t -> new HashMap<>())
                .computeIfAbsent(name, n -> new HashMap<>())
                .put(option, value);
        return this;
    }

    @Override
    public Map<String, Object> getGlobal() {
        return new HashMap<>(global);
    }

    @Override
    public Map<String, Object> getGroup(ClientType type) {
        return new HashMap<>(groups.getOrDefault(type, Map.of()));
    }

    @Override
    public Map<String, Object> getInstance(ClientType type, String name) {
        return new HashMap<>(instances.getOrDefault(type, Map.of()).getOrDefault(name, Map.of()));
    }
}
