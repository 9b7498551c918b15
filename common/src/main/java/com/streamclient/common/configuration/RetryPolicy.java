package com.streamclient.common.configuration;

import com.streamclient.common.exception.ConfigurationException;

/**
 * Bounded exponential backoff settings of a consumer
 */
public final class RetryPolicy {
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final int maxRetries;

    private RetryPolicy(long initialDelayMs, long maxDelayMs, double multiplier, int maxRetries) {
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.multiplier = multiplier;
        this.maxRetries = maxRetries;
    }

    public static RetryPolicy from(ResolvedConfiguration configuration) throws ConfigurationException {
        String name = configuration.getName();
        long initialDelayMs = configuration.getLong(ConfigurationOption.RETRY_DELAY);
        long maxDelayMs = configuration.getLong(ConfigurationOption.MAX_RETRY_DELAY);
        double multiplier = configuration.getDouble(ConfigurationOption.RETRY_MULTIPLIER);
        int maxRetries = configuration.getInt(ConfigurationOption.MAX_RETRIES);

        if (initialDelayMs <= 0) {
            throw ConfigurationException.invalidValue(name, ConfigurationOption.RETRY_DELAY.getOptionName(),
                    initialDelayMs, "must be greater than 0");
        }
        if (multiplier < 1) {
            throw ConfigurationException.invalidValue(name, ConfigurationOption.RETRY_MULTIPLIER.getOptionName(),
                    multiplier, "must be at least 1");
        }
        if (maxDelayMs < initialDelayMs) {
            throw ConfigurationException.invalidValue(name, ConfigurationOption.MAX_RETRY_DELAY.getOptionName(),
                    maxDelayMs, "must not be lower than " + ConfigurationOption.RETRY_DELAY.getOptionName());
        }
        if (maxRetries < 0) {
            throw ConfigurationException.invalidValue(name, ConfigurationOption.MAX_RETRIES.getOptionName(),
                    maxRetries, "must not be negative");
        }
        return new RetryPolicy(initialDelayMs, maxDelayMs, multiplier, maxRetries);
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public String toString() {
        return "RetryPolicy{initialDelayMs=" + initialDelayMs +
               ", maxDelayMs=" + maxDelayMs +
               ", multiplier=" + multiplier +
               ", maxRetries=" + maxRetries + '}';
    }
}
