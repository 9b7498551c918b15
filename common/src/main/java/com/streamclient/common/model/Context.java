package com.streamclient.common.model;

import com.streamclient.common.configuration.ConfigurationOption;
import com.streamclient.common.configuration.ResolvedConfiguration;

/**
 * Per-attempt context passed to a consumer and to its exception hook.
 * A fresh instance is built for every attempt; retry numbers start at 0.
 */
public final class Context {
    private final ResolvedConfiguration configuration;
    private final int retryNumber;

    public Context(ResolvedConfiguration configuration, int retryNumber) {
        this.configuration = configuration;
        this.retryNumber = retryNumber;
    }

    public ResolvedConfiguration getConfiguration() {
        return configuration;
    }

    public int getRetryNumber() {
        return retryNumber;
    }

    public boolean isLastAttempt() {
        return retryNumber >= configuration.getInt(ConfigurationOption.MAX_RETRIES);
    }

    @Override
    public String toString() {
        return "Context{consumer='" + configuration.getName() + "', retryNumber=" + retryNumber + '}';
    }
}
