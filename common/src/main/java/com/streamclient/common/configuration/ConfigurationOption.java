package com.streamclient.common.configuration;

import java.util.List;

/**
 * Options understood by the consumer and producer clients, with their defaults.
 */
public enum ConfigurationOption {
    BROKERS("brokers", Scope.COMMON, OptionType.LIST, List.of("127.0.0.1:9092")),
    TOPICS("topics", Scope.COMMON, OptionType.LIST, List.of()),
    DECODER("decoder", Scope.COMMON, OptionType.STRING, "plain"),

    TIMEOUT("timeout", Scope.CONSUMER, OptionType.LONG, 1000L),
    GROUP_ID("group-id", Scope.CONSUMER, OptionType.STRING, "stream_client"),
    AUTO_OFFSET_RESET("auto-offset-reset", Scope.CONSUMER, OptionType.STRING, "earliest"),
    ENABLE_AUTO_COMMIT("enable-auto-commit", Scope.CONSUMER, OptionType.BOOLEAN, Boolean.TRUE),
    AUTO_COMMIT_INTERVAL_MS("auto-commit-interval-ms", Scope.CONSUMER, OptionType.LONG, 50L),
    MAX_RETRIES("max-retries", Scope.CONSUMER, OptionType.INTEGER, 0),
    RETRY_DELAY("retry-delay", Scope.CONSUMER, OptionType.LONG, 200L),
    MAX_RETRY_DELAY("max-retry-delay", Scope.CONSUMER, OptionType.LONG, 2000L),
    RETRY_MULTIPLIER("retry-multiplier", Scope.CONSUMER, OptionType.DOUBLE, 2.0d),

    PRODUCER_PARTITION("producer-partition", Scope.PRODUCER, OptionType.INTEGER, -1),
    FLUSH_TIMEOUT("flush-timeout", Scope.PRODUCER, OptionType.LONG, 10000L);

    private final String optionName;
    private final Scope scope;
    private final OptionType type;
    private final Object defaultValue;

    ConfigurationOption(String optionName, Scope scope, OptionType type, Object defaultValue) {
        this.optionName = optionName;
        this.scope = scope;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    public String getOptionName() {
        return optionName;
    }

    public OptionType getType() {
        return type;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean appliesTo(ClientType clientType) {
        switch (scope) {
            case CONSUMER:
                return clientType == ClientType.CONSUMER;
            case PRODUCER:
                return clientType == ClientType.PRODUCER;
            default:
                return true;
        }
    }

    public static ConfigurationOption fromName(String optionName) {
        for (ConfigurationOption option : values()) {
            if (option.optionName.equals(optionName)) {
                return option;
            }
        }
        return null;
    }

    enum Scope {
        COMMON,
        CONSUMER,
        PRODUCER
    }
}
