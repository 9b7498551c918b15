package com.streamclient.common.configuration;

import java.util.Map;

/**
 * Raw settings the resolver merges, from least to most specific.
 */
public interface ConfigurationSource {

    /**
     * Settings shared by every consumer and producer
     */
    Map<String, Object> getGlobal();

    /**
     * Settings shared by all clients of one type
     */
    Map<String, Object> getGroup(ClientType type);

    /**
     * Settings of one named client; empty when the client is not declared
     */
    Map<String, Object> getInstance(ClientType type, String name);
}
