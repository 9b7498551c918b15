package com.streamclient.common.configuration;

import com.streamclient.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges defaults, global, group and instance settings (plus optional runtime overrides)
 * into a {@link ResolvedConfiguration} for one named consumer or producer.
 *
 * Precedence, lowest first: option defaults, global, group, instance, runtime overrides.
 * Global and group settings may hold other sections, so keys that are not options of the
 * client type are skipped there. Instance settings and overrides must only contain options.
 *
 * Configurations resolved without overrides are memoized per client type and name.
 */
public class ConfigurationResolver {
    private static final Logger log = LoggerFactory.getLogger(ConfigurationResolver.class);

    private final ConfigurationSource source;
    private final Map<String, ResolvedConfiguration> resolved = new HashMap<>();

    public ConfigurationResolver(ConfigurationSource source) {
        this.source = source;
    }

    public ResolvedConfiguration resolve(ClientType type, String name) throws ConfigurationException {
        return resolve(type, name, Map.of());
    }

    public synchronized ResolvedConfiguration resolve(ClientType type, String name, Map<String, Object> overrides)
            throws ConfigurationException {
        boolean memoizable = overrides == null || overrides.isEmpty();
        String cacheKey = type + ":" + name;

        if (memoizable && resolved.containsKey(cacheKey)) {
            return resolved.get(cacheKey);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (ConfigurationOption option : ConfigurationOption.values()) {
            if (option.appliesTo(type)) {
                values.put(option.getOptionName(), option.getDefaultValue());
            }
        }

        merge(values, type, name, source.getGlobal(), false);
        merge(values, type, name, source.getGroup(type), false);
        merge(values, type, name, source.getInstance(type, name), true);
        if (!memoizable) {
            merge(values, type, name, overrides, true);
        }

        ResolvedConfiguration configuration = new ResolvedConfiguration(type, name, values);
        validate(configuration);

        if (memoizable) {
            resolved.put(cacheKey, configuration);
            log.debug("Resolved configuration for {} '{}': {}", type, name, values);
        }
        return configuration;
    }

    private void merge(Map<String, Object> values, ClientType type, String name,
                       Map<String, Object> layer, boolean strict) throws ConfigurationException {
        if (layer == null) {
            return;
        }
        for (Map.Entry<String, Object> entry : layer.entrySet()) {
            ConfigurationOption option = ConfigurationOption.fromName(entry.getKey());
            if (option == null || !option.appliesTo(type)) {
                if (strict) {
                    throw ConfigurationException.unknownOption(name, entry.getKey());
                }
                continue;
            }
            if (entry.getValue() == null) {
                continue;
            }
            try {
                values.put(option.getOptionName(), option.getType().convert(entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw ConfigurationException.invalidValue(name, option.getOptionName(), entry.getValue(),
                        "expected " + option.getType().name().toLowerCase());
            }
        }
    }

    private void validate(ResolvedConfiguration configuration) throws ConfigurationException {
        String name = configuration.getName();
        requireNotEmpty(name, configuration.getList(ConfigurationOption.BROKERS), ConfigurationOption.BROKERS);
        requireNotEmpty(name, configuration.getList(ConfigurationOption.TOPICS), ConfigurationOption.TOPICS);
        if (configuration.getString(ConfigurationOption.DECODER).isEmpty()) {
            throw ConfigurationException.missingValue(name, ConfigurationOption.DECODER.getOptionName());
        }

        if (configuration.getType() == ClientType.CONSUMER) {
            long timeout = configuration.getLong(ConfigurationOption.TIMEOUT);
            if (timeout < 0) {
                throw ConfigurationException.invalidValue(name, ConfigurationOption.TIMEOUT.getOptionName(),
                        timeout, "must not be negative");
            }
            RetryPolicy.from(configuration);
        } else {
            long flushTimeout = configuration.getLong(ConfigurationOption.FLUSH_TIMEOUT);
            if (flushTimeout <= 0) {
                throw ConfigurationException.invalidValue(name, ConfigurationOption.FLUSH_TIMEOUT.getOptionName(),
                        flushTimeout, "must be greater than 0");
            }
        }
    }

    private void requireNotEmpty(String name, List<String> values, ConfigurationOption option)
            throws ConfigurationException {
        if (values == null || values.isEmpty()) {
            throw ConfigurationException.missingValue(name, option.getOptionName());
        }
    }
}
