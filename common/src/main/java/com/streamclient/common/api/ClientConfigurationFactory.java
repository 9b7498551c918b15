package com.streamclient.common.api;

import com.streamclient.common.configuration.ResolvedConfiguration;

import java.util.Properties;

/**
 * Translates a resolved configuration into the messaging client's own configuration
 */
public interface ClientConfigurationFactory {

    Properties create(ResolvedConfiguration configuration);
}
